package com.decisionswarm.common.consensus;

import com.decisionswarm.common.model.AgentOutcome;

import java.util.Comparator;
import java.util.List;

/**
 * Quorum gate in front of a {@link ConsensusEngine}.
 *
 * <p>Drops every non-ok outcome, sorts the rest by agent id (so engines iterate in a
 * stable order regardless of arrival order) and refuses to aggregate when fewer than
 * {@code minQuorum} remain. A quorum below 1 is treated as 1: zero ok outcomes is always
 * a failure, never a low-confidence success.
 *
 * <p>No logging, no reactive types, no state.
 */
public final class ConsensusAggregator {

    private final ConsensusEngine engine;

    public ConsensusAggregator(ConsensusEngine engine) {
        this.engine = engine;
    }

    public AggregationOutcome aggregate(List<AgentOutcome> outcomes, int minQuorum) {
        int quorum = Math.max(1, minQuorum);
        List<AgentOutcome> ok = outcomes == null ? List.of() : outcomes.stream()
            .filter(AgentOutcome::isOk)
            .sorted(Comparator.comparing(AgentOutcome::agentId))
            .toList();

        if (ok.size() < quorum) {
            int total = outcomes == null ? 0 : outcomes.size();
            return AggregationOutcome.failure(FailureReason.INSUFFICIENT_QUORUM,
                String.format("%d of %d agents returned ok, quorum is %d", ok.size(), total, quorum));
        }
        return AggregationOutcome.success(engine.compute(ok));
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
