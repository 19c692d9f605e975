package com.decisionswarm.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Run-id propagation for reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the run id. MDC is only written
 * for the duration of a single log statement, because stage work hops between
 * scheduler threads and a ThreadLocal would leak between concurrent runs.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, runId);
 *     ...
 *     Mono.deferContextual(ctx -> ... TraceContextUtil.getRunId(ctx) ...)
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream at subscription, so apply it last when assembling the chain.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** The run id stored in {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN);
    }

    /** Bridges {@code runId} into MDC while {@code logAction} runs, then removes it. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
