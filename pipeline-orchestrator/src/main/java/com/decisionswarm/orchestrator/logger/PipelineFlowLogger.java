package com.decisionswarm.orchestrator.logger;

import com.decisionswarm.common.model.PipelineResult;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.StageTrace;
import com.decisionswarm.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lifecycle logging for pipeline runs. Pure side effects; nothing here influences the
 * pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_RECEIVED}: query accepted, config resolved</li>
 *   <li>{@link #STAGE_STARTED}: a swarm is about to be dispatched</li>
 *   <li>{@link #STAGE_COMPLETED} or {@link #STAGE_FAILED}: the swarm's verdict</li>
 *   <li>{@link #RUN_COMPLETED}: the {@link PipelineResult} is assembled</li>
 * </ol>
 *
 * <p>The run id is bridged into MDC only for the duration of each log call.
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_RECEIVED    = "RUN_RECEIVED";
    public static final String STAGE_STARTED   = "STAGE_STARTED";
    public static final String STAGE_COMPLETED = "STAGE_COMPLETED";
    public static final String STAGE_FAILED    = "STAGE_FAILED";
    public static final String RUN_COMPLETED   = "RUN_COMPLETED";

    public void runReceived(String runId, String query) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[PipelineFlow] stage={} runId={} queryLength={}", RUN_RECEIVED, runId, query.length()));
    }

    public void stageStarted(String runId, Stage stage, int agentCount) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[PipelineFlow] stage={} pipelineStage={} agents={} runId={}",
                STAGE_STARTED, stage.displayName(), agentCount, runId));
    }

    public void stageFinished(String runId, StageTrace trace) {
        TraceContextUtil.withMdc(runId, () -> {
            if (trace.succeeded()) {
                log.info("[PipelineFlow] stage={} pipelineStage={} confidence={} agreement={} durationMs={} runId={}",
                    STAGE_COMPLETED, trace.stage().displayName(),
                    String.format("%.3f", trace.consensus().confidence()),
                    String.format("%.3f", trace.consensus().agreementScore()),
                    trace.durationMs(), runId);
            } else {
                log.warn("[PipelineFlow] stage={} pipelineStage={} reason={} detail={} durationMs={} runId={}",
                    STAGE_FAILED, trace.stage().displayName(), trace.failureReason().wireName(),
                    trace.failureDetail(), trace.durationMs(), runId);
            }
        });
    }

    public void runCompleted(PipelineResult result) {
        TraceContextUtil.withMdc(result.runId(), () ->
            log.info("[PipelineFlow] stage={} overallSuccess={} firstFailedStage={} stagesRun={} totalDurationMs={} runId={}",
                RUN_COMPLETED, result.overallSuccess(),
                result.firstFailedStage() != null ? result.firstFailedStage().displayName() : "none",
                result.stages().size(), result.totalDurationMs(), result.runId()));
    }
}
