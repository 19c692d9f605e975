package com.decisionswarm.swarm.llm;

import reactor.core.publisher.Mono;

/**
 * Black-box "send text, receive text" capability of a regional inference endpoint.
 *
 * <p>Implementations signal transport problems as an error on the returned {@code Mono}
 * (typically {@link com.decisionswarm.common.exception.InferenceException}) and must be
 * stateless apart from the shared connection pool. Timeouts are applied by the caller.
 */
public interface InferenceClient {

    /**
     * @param region logical endpoint selector taken from the agent descriptor
     * @param prompt fully rendered prompt
     * @return the raw completion text
     */
    Mono<String> complete(String region, String prompt);
}
