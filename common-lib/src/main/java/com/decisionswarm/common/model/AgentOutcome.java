package com.decisionswarm.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one agent executing one task.
 *
 * <p>{@code value} and {@code rawConfidence} are present only when {@code status == OK};
 * {@code detail} carries the failure description otherwise. Instances are consumed by the
 * aggregator and never retained past the dispatch.
 */
public record AgentOutcome(
    String agentId,
    OutcomeStatus status,
    Map<String, Object> value,
    Double rawConfidence,
    long latencyMs,
    String detail
) {
    public AgentOutcome {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(status, "status");
        if (status == OutcomeStatus.OK) {
            Objects.requireNonNull(value, "value is required for an ok outcome");
            Objects.requireNonNull(rawConfidence, "rawConfidence is required for an ok outcome");
            if (rawConfidence < 0.0 || rawConfidence > 1.0) {
                throw new IllegalArgumentException("rawConfidence out of [0,1]: " + rawConfidence);
            }
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        } else {
            value = null;
            rawConfidence = null;
        }
    }

    public static AgentOutcome ok(String agentId, Map<String, Object> value,
                                  double rawConfidence, long latencyMs) {
        return new AgentOutcome(agentId, OutcomeStatus.OK, value, rawConfidence, latencyMs, null);
    }

    public static AgentOutcome failed(String agentId, OutcomeStatus status,
                                      long latencyMs, String detail) {
        if (status == OutcomeStatus.OK) {
            throw new IllegalArgumentException("failed outcome cannot carry status ok");
        }
        return new AgentOutcome(agentId, status, null, null, latencyMs, detail);
    }

    public boolean isOk() {
        return status == OutcomeStatus.OK;
    }
}
