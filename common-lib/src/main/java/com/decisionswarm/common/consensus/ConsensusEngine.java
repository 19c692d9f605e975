package com.decisionswarm.common.consensus;

import com.decisionswarm.common.model.AgentOutcome;

import java.util.List;

/**
 * Strategy contract for reducing successful agent outcomes to one stage answer.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Order independent</b>: the same multiset of outcomes always yields an equal result</li>
 *   <li><b>Non-inventing</b>: the consensus value is always one an agent actually proposed</li>
 * </ul>
 *
 * <p>Quorum enforcement and filtering of failed outcomes happen in {@link ConsensusAggregator};
 * engines only ever see a non-empty list of ok outcomes.
 */
public interface ConsensusEngine {

    /**
     * @param okOutcomes non-null, non-empty list of outcomes with status ok
     * @return a {@link ConsensusResult}: never {@code null}
     */
    ConsensusResult compute(List<AgentOutcome> okOutcomes);

    ConsensusAlgorithm algorithm();
}
