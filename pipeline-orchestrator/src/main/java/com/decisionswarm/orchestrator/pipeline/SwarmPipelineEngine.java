package com.decisionswarm.orchestrator.pipeline;

import com.decisionswarm.common.consensus.AggregationOutcome;
import com.decisionswarm.common.consensus.FailureReason;
import com.decisionswarm.common.model.PipelineResult;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.StageTrace;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.trace.TraceContextUtil;
import com.decisionswarm.orchestrator.config.PipelineConfig;
import com.decisionswarm.orchestrator.logger.PipelineFlowLogger;
import com.decisionswarm.swarm.swarm.Swarm;
import com.decisionswarm.swarm.swarm.SwarmFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the four swarms strictly in sequence.
 *
 * <h3>State machine</h3>
 * <ol>
 *   <li>Start in {@link PipelineState#INTENT} with payload {@code {query}}.</li>
 *   <li>Each stage dispatches a fresh {@link Task} built from the payload accumulated so far.</li>
 *   <li>On success the stage's consensus value is added under {@link Stage#payloadKey()} and the
 *       machine moves to the next stage, ending in {@link PipelineState#DONE}.</li>
 *   <li>On failure the machine moves to {@link PipelineState#FAILED}; no later swarm is invoked.</li>
 * </ol>
 *
 * <p>Every executed stage leaves a {@link StageTrace}, whatever its outcome. Unexpected errors
 * inside a stage are converted to a {@code STAGE_ERROR} failure, so the returned {@code Mono}
 * always emits a complete {@link PipelineResult} and never errors.
 *
 * <p>The run id is read from the Reactor Context ({@link TraceContextUtil}).
 */
@Component
public class SwarmPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(SwarmPipelineEngine.class);

    static final String QUERY_KEY = "query";

    private final SwarmFactory swarmFactory;
    private final PipelineFlowLogger flowLogger;

    public SwarmPipelineEngine(SwarmFactory swarmFactory, PipelineFlowLogger flowLogger) {
        this.swarmFactory = swarmFactory;
        this.flowLogger = flowLogger;
    }

    public Mono<PipelineResult> runPipeline(String query, PipelineConfig config) {
        return Mono.deferContextual(ctx -> {
            String runId = TraceContextUtil.getRunId(ctx);
            long startNanos = System.nanoTime();
            Progress initial = Progress.start(query);

            return advance(initial, config, runId)
                .map(done -> new PipelineResult(
                    runId,
                    query,
                    done.state() == PipelineState.DONE,
                    done.firstFailedStage(),
                    done.traces(),
                    elapsedMillis(startNanos)))
                .doOnNext(flowLogger::runCompleted);
        });
    }

    private Mono<Progress> advance(Progress progress, PipelineConfig config, String runId) {
        if (progress.state().isTerminal()) {
            return Mono.just(progress);
        }
        Stage stage = progress.state().stage();
        return runStage(stage, progress.payload(), config, runId)
            .flatMap(trace -> advance(progress.record(trace), config, runId));
    }

    private Mono<StageTrace> runStage(Stage stage, Map<String, Object> payload,
                                      PipelineConfig config, String runId) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            flowLogger.stageStarted(runId, stage, config.rosterFor(stage).size());

            Task task = Task.create(stage.taskType(), payload);
            Swarm swarm = swarmFactory.create(stage, config.rosterFor(stage));

            return swarm.run(task, config.settingsFor(stage))
                .map(result -> StageTrace.of(stage, task.taskId(), result.aggregation(),
                    elapsedMillis(startNanos), result.reports()))
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(runId, () ->
                        log.error("[Pipeline] stage={} raised unexpectedly, recording stage_error", stage.displayName(), e));
                    return Mono.just(StageTrace.of(stage, task.taskId(),
                        AggregationOutcome.failure(FailureReason.STAGE_ERROR, describe(e)),
                        elapsedMillis(startNanos), List.of()));
                });
        })
        .onErrorResume(e -> {
            // task or swarm construction failed before anything was dispatched
            TraceContextUtil.withMdc(runId, () ->
                log.error("[Pipeline] stage={} could not be started", stage.displayName(), e));
            return Mono.just(StageTrace.of(stage, null,
                AggregationOutcome.failure(FailureReason.STAGE_ERROR, describe(e)), 0L, List.of()));
        })
        .doOnNext(trace -> flowLogger.stageFinished(runId, trace));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /**
     * Immutable snapshot between stages: where the machine is, what the next stage will
     * receive, and what has been recorded so far.
     */
    record Progress(PipelineState state, Map<String, Object> payload,
                    List<StageTrace> traces, Stage firstFailedStage) {

        static Progress start(String query) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(QUERY_KEY, query);
            return new Progress(PipelineState.initial(), Collections.unmodifiableMap(payload), List.of(), null);
        }

        Progress record(StageTrace trace) {
            List<StageTrace> traces = new ArrayList<>(this.traces);
            traces.add(trace);
            if (!trace.succeeded()) {
                return new Progress(state.onFailure(), payload, List.copyOf(traces), trace.stage());
            }
            Map<String, Object> next = new LinkedHashMap<>(payload);
            next.put(trace.stage().payloadKey(), trace.consensus().consensusValue());
            return new Progress(state.onSuccess(), Collections.unmodifiableMap(next), List.copyOf(traces), null);
        }
    }
}
