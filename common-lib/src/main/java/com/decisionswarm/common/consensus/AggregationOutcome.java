package com.decisionswarm.common.consensus;

/**
 * Either a {@link ConsensusResult} or a typed failure, never both.
 * Callers branch on {@link #succeeded()} instead of catching exceptions.
 */
public record AggregationOutcome(
    ConsensusResult consensus,
    FailureReason failureReason,
    String failureDetail
) {
    public AggregationOutcome {
        if ((consensus == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of consensus or failureReason must be set");
        }
    }

    public static AggregationOutcome success(ConsensusResult consensus) {
        return new AggregationOutcome(consensus, null, null);
    }

    public static AggregationOutcome failure(FailureReason reason, String detail) {
        return new AggregationOutcome(null, reason, detail);
    }

    public boolean succeeded() {
        return consensus != null;
    }
}
