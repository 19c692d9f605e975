package com.decisionswarm.swarm.agent;

import com.decisionswarm.common.exception.MalformedOutputException;
import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.OutcomeStatus;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.swarm.llm.InferenceClient;
import com.decisionswarm.swarm.llm.InferenceProperties;
import com.decisionswarm.swarm.parse.OutcomeParser;
import com.decisionswarm.swarm.prompt.PromptFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link AgentInvoker} backed by a remote LLM.
 *
 * <p>Per invocation: render the prompt, call the agent's regional endpoint under
 * {@code agentTimeout}, parse the completion against the task type schema. A timed-out
 * or failed call is retried once after the configured backoff. A malformed completion
 * is recorded as-is without a retry.
 *
 * <p>Classification: {@link TimeoutException} becomes {@code TIMEOUT},
 * {@link MalformedOutputException} becomes {@code MALFORMED_OUTPUT}, anything else
 * becomes {@code TRANSPORT_ERROR}.
 */
@Component
public class LlmInvocationAdapter implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(LlmInvocationAdapter.class);

    static final int MAX_RETRIES = 1;

    private final InferenceClient inferenceClient;
    private final PromptFactory promptFactory;
    private final OutcomeParser outcomeParser;
    private final Duration retryBackoff;

    @Autowired
    public LlmInvocationAdapter(InferenceClient inferenceClient,
                                PromptFactory promptFactory,
                                OutcomeParser outcomeParser,
                                InferenceProperties properties) {
        this(inferenceClient, promptFactory, outcomeParser, properties.getRetryBackoff());
    }

    public LlmInvocationAdapter(InferenceClient inferenceClient,
                                PromptFactory promptFactory,
                                OutcomeParser outcomeParser,
                                Duration retryBackoff) {
        this.inferenceClient = inferenceClient;
        this.promptFactory = promptFactory;
        this.outcomeParser = outcomeParser;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public Mono<AgentOutcome> invoke(SwarmAgent agent, Task task, Duration agentTimeout) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();

            return Mono.fromCallable(() -> promptFactory.build(agent, task))
                .flatMap(prompt -> Mono.defer(() -> inferenceClient.complete(agent.region(), prompt))
                    .timeout(agentTimeout)
                    .retryWhen(Retry.fixedDelay(MAX_RETRIES, retryBackoff)
                        .filter(e -> statusOf(e).isRetryable())
                        .doBeforeRetry(signal -> log.warn("[Agent] {} attempt failed ({}), retrying in {}ms",
                            agent.agentId(), describe(signal.failure()), retryBackoff.toMillis()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure())))
                .map(completion -> outcomeParser.parse(agent.agentId(), task.taskType(), completion))
                .map(parsed -> AgentOutcome.ok(agent.agentId(), parsed.value(), parsed.confidence(),
                    elapsedMillis(startNanos)))
                .onErrorResume(e -> Mono.just(classify(agent, e, elapsedMillis(startNanos))))
                .doOnNext(outcome -> log.debug("[Agent] {} region={} task={} status={} latencyMs={}",
                    agent.agentId(), agent.region(), task.taskId(), outcome.status(), outcome.latencyMs()));
        });
    }

    static OutcomeStatus statusOf(Throwable error) {
        if (error instanceof TimeoutException) {
            return OutcomeStatus.TIMEOUT;
        }
        if (error instanceof MalformedOutputException) {
            return OutcomeStatus.MALFORMED_OUTPUT;
        }
        return OutcomeStatus.TRANSPORT_ERROR;
    }

    static AgentOutcome classify(SwarmAgent agent, Throwable error, long latencyMs) {
        OutcomeStatus status = statusOf(error);
        log.warn("[Agent] {} failed with {}: {}", agent.agentId(), status, describe(error));
        return AgentOutcome.failed(agent.agentId(), status, latencyMs, describe(error));
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
