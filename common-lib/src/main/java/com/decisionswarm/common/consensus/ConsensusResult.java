package com.decisionswarm.common.consensus;

import java.util.List;
import java.util.Map;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code consensusValue}: the selected structured value for the stage</li>
 *   <li>{@code confidence}: {@code agreementScore × mean(contributing confidence)}, in [0.0, 1.0]</li>
 *   <li>{@code agreementScore}: agent concordance in [0.0, 1.0]</li>
 *   <li>{@code participatingAgents}: ids of every ok outcome that entered aggregation, sorted; never empty</li>
 *   <li>{@code algorithmUsed}: strategy that produced this result</li>
 * </ul>
 */
public record ConsensusResult(
    Map<String, Object> consensusValue,
    double confidence,
    double agreementScore,
    List<String> participatingAgents,
    ConsensusAlgorithm algorithmUsed
) {
    public ConsensusResult {
        if (participatingAgents == null || participatingAgents.isEmpty()) {
            throw new IllegalArgumentException("a consensus result needs at least one participating agent");
        }
        participatingAgents = List.copyOf(participatingAgents);
    }
}
