package com.decisionswarm.common.model;

import java.util.List;
import java.util.Map;

/**
 * End-to-end trace of one pipeline run.
 *
 * <p>{@code overallSuccess} is true only when all four stages succeeded. On failure,
 * {@code stages} holds every stage that actually ran (the failing one last) and
 * {@code firstFailedStage} names it; stages after it are absent because they were
 * never invoked.
 *
 * <p>Built once by the pipeline engine, returned to the caller, never persisted here.
 */
public record PipelineResult(
    String runId,
    String query,
    boolean overallSuccess,
    Stage firstFailedStage,
    List<StageTrace> stages,
    long totalDurationMs
) {
    public PipelineResult {
        stages = List.copyOf(stages);
    }

    /** Solver consensus value when the run succeeded, otherwise {@code null}. */
    public Map<String, Object> solution() {
        if (!overallSuccess) return null;
        return stages.stream()
            .filter(t -> t.stage() == Stage.SOLVER)
            .findFirst()
            .map(t -> t.consensus().consensusValue())
            .orElse(null);
    }
}
