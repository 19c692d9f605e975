package com.decisionswarm.common.model;

import com.decisionswarm.common.consensus.AggregationOutcome;
import com.decisionswarm.common.consensus.ConsensusResult;
import com.decisionswarm.common.consensus.FailureReason;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-stage entry of a {@link PipelineResult}. Exactly one of {@code consensus} and
 * {@code failureReason} is set, mirroring {@link AggregationOutcome}.
 */
public record StageTrace(
    Stage stage,
    String taskId,
    StageStatus status,
    ConsensusResult consensus,
    FailureReason failureReason,
    String failureDetail,
    long durationMs,
    List<AgentReport> agents
) {
    public StageTrace {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public static StageTrace of(Stage stage, String taskId, AggregationOutcome aggregation,
                                long durationMs, List<AgentReport> agents) {
        return aggregation.succeeded()
            ? new StageTrace(stage, taskId, StageStatus.SUCCESS, aggregation.consensus(),
                             null, null, durationMs, agents)
            : new StageTrace(stage, taskId, StageStatus.FAILED, null,
                             aggregation.failureReason(), aggregation.failureDetail(), durationMs, agents);
    }

    @JsonProperty("swarmId")
    public String swarmId() {
        return stage.swarmId();
    }

    public boolean succeeded() {
        return status == StageStatus.SUCCESS;
    }
}
