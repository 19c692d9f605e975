package com.decisionswarm.swarm.swarm;

import com.decisionswarm.common.consensus.AggregationOutcome;
import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.AgentReport;
import com.decisionswarm.common.model.Task;

import java.util.List;

/** One swarm run: the dispatched task, every agent's outcome and the aggregation verdict. */
public record SwarmResult(
    String swarmId,
    Task task,
    List<AgentOutcome> outcomes,
    List<AgentReport> reports,
    AggregationOutcome aggregation
) {
    public SwarmResult {
        outcomes = List.copyOf(outcomes);
        reports = List.copyOf(reports);
    }

    public boolean succeeded() {
        return aggregation.succeeded();
    }
}
