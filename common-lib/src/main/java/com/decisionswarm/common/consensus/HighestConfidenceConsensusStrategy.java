package com.decisionswarm.common.consensus;

import com.decisionswarm.common.model.AgentOutcome;

import java.util.List;

/**
 * {@link ConsensusEngine} for stages whose answer is a compound structure
 * (a built model, a solve recommendation) that cannot be voted on field by field.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Select the ok outcome with the highest raw confidence (ties → smallest agent id).
 *       Its value is the consensus value, unmodified.</li>
 *   <li>If a {@code compatibilityField} is configured and the selected value carries it,
 *       {@code agreementScore} is the fraction of ok outcomes whose normalized field value
 *       matches the selection, and those outcomes are the contributors.</li>
 *   <li>Otherwise {@code agreementScore = 1 / |ok|} and the selection is the only contributor.</li>
 *   <li>{@code confidence = agreementScore × mean(raw confidence of contributors)}.</li>
 * </ol>
 */
public class HighestConfidenceConsensusStrategy implements ConsensusEngine {

    private final String compatibilityField;

    /**
     * @param compatibilityField value field naming the structure's category, e.g.
     *                           {@code model_type}; {@code null} when the stage has none
     */
    public HighestConfidenceConsensusStrategy(String compatibilityField) {
        this.compatibilityField = compatibilityField;
    }

    @Override
    public ConsensusResult compute(List<AgentOutcome> okOutcomes) {
        AgentOutcome selected = null;
        for (AgentOutcome o : okOutcomes) {
            if (selected == null
                    || o.rawConfidence() > selected.rawConfidence() + MajorityVoteConsensusStrategy.CONFIDENCE_EPSILON
                    || (Math.abs(o.rawConfidence() - selected.rawConfidence())
                            <= MajorityVoteConsensusStrategy.CONFIDENCE_EPSILON
                        && o.agentId().compareTo(selected.agentId()) < 0)) {
                selected = o;
            }
        }

        String category = compatibilityField == null ? null
            : LabelNormalizer.normalize(selected.value().get(compatibilityField));

        List<AgentOutcome> contributors;
        if (category == null) {
            contributors = List.of(selected);
        } else {
            contributors = okOutcomes.stream()
                .filter(o -> category.equals(LabelNormalizer.normalize(o.value().get(compatibilityField))))
                .toList();
        }

        double agreement = (double) contributors.size() / okOutcomes.size();
        double meanConfidence = contributors.stream()
            .mapToDouble(AgentOutcome::rawConfidence)
            .average()
            .orElse(0.0);

        return new ConsensusResult(
            selected.value(),
            ConsensusAggregator.clamp(agreement * meanConfidence),
            agreement,
            okOutcomes.stream().map(AgentOutcome::agentId).sorted().toList(),
            algorithm());
    }

    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.HIGHEST_CONFIDENCE;
    }
}
