package com.decisionswarm.common.consensus;

import com.decisionswarm.common.model.AgentOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link ConsensusEngine} for stages whose answer is a single categorical label
 * (e.g. the primary intent).
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Group ok outcomes by the normalized value of {@code labelField}.</li>
 *   <li>Winner = the largest group. Ties go to the group with the higher average
 *       raw confidence, then to the group whose smallest agent id sorts first.</li>
 *   <li>{@code agreementScore = |winner| / |ok|}.</li>
 *   <li>{@code confidence = agreementScore × mean(raw confidence of the winner's supporters)}.</li>
 *   <li>The consensus value is the full value of the winner's most confident supporter
 *       (ties → smallest agent id), so no field is ever invented or merged.</li>
 * </ol>
 *
 * <p>Example: labels {@code A,A,A,B,B} with confidences {@code 0.9,0.8,0.7,0.6,0.5}
 * → {@code A}, agreement 0.6, confidence 0.6 × 0.8 = 0.48.
 */
public class MajorityVoteConsensusStrategy implements ConsensusEngine {

    /** Averages closer than this are treated as equal before falling back to agent id. */
    static final double CONFIDENCE_EPSILON = 1e-9;

    private final String labelField;

    public MajorityVoteConsensusStrategy(String labelField) {
        this.labelField = labelField;
    }

    @Override
    public ConsensusResult compute(List<AgentOutcome> okOutcomes) {
        // TreeMap + id-sorted input: iteration is fully determined by the multiset of outcomes
        Map<String, List<AgentOutcome>> groups = new TreeMap<>();
        List<String> participants = new ArrayList<>();
        for (AgentOutcome o : okOutcomes) {
            participants.add(o.agentId());
            String label = LabelNormalizer.normalize(o.value().get(labelField));
            groups.computeIfAbsent(label == null ? "" : label, k -> new ArrayList<>()).add(o);
        }

        Candidate best = null;
        for (List<AgentOutcome> supporters : groups.values()) {
            Candidate c = Candidate.of(supporters);
            if (best == null || c.beats(best)) {
                best = c;
            }
        }

        double agreement = (double) best.supporters().size() / okOutcomes.size();
        double confidence = ConsensusAggregator.clamp(agreement * best.averageConfidence());

        return new ConsensusResult(
            best.representative().value(),
            confidence,
            agreement,
            participants.stream().sorted().toList(),
            algorithm());
    }

    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.MAJORITY_VOTE;
    }

    private record Candidate(List<AgentOutcome> supporters, double averageConfidence,
                             String minAgentId, AgentOutcome representative) {

        static Candidate of(List<AgentOutcome> supporters) {
            double sum = 0.0;
            String minId = null;
            AgentOutcome rep = null;
            for (AgentOutcome o : supporters) {
                sum += o.rawConfidence();
                if (minId == null || o.agentId().compareTo(minId) < 0) {
                    minId = o.agentId();
                }
                if (rep == null
                        || o.rawConfidence() > rep.rawConfidence() + CONFIDENCE_EPSILON
                        || (Math.abs(o.rawConfidence() - rep.rawConfidence()) <= CONFIDENCE_EPSILON
                            && o.agentId().compareTo(rep.agentId()) < 0)) {
                    rep = o;
                }
            }
            return new Candidate(supporters, sum / supporters.size(), minId, rep);
        }

        boolean beats(Candidate other) {
            if (supporters.size() != other.supporters.size()) {
                return supporters.size() > other.supporters.size();
            }
            if (Math.abs(averageConfidence - other.averageConfidence) > CONFIDENCE_EPSILON) {
                return averageConfidence > other.averageConfidence;
            }
            return minAgentId.compareTo(other.minAgentId) < 0;
        }
    }
}
