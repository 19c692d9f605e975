package com.decisionswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable, stateless agent descriptor. The same instance may serve any number of
 * concurrent tasks; nothing task-specific is ever stored on it.
 *
 * @param agentId        unique within a swarm; also the final deterministic tie-break key
 * @param specialization free-form prompting angle, e.g. {@code mathematical_formulation}
 * @param role           coarse category
 * @param region         logical endpoint selector resolved by the inference client
 */
public record SwarmAgent(
    @JsonProperty("agentId") String agentId,
    @JsonProperty("specialization") String specialization,
    @JsonProperty("role") AgentRole role,
    @JsonProperty("region") String region
) {
    public SwarmAgent {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(specialization, "specialization");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(region, "region");
        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
    }

    public static SwarmAgent of(String agentId, String specialization, AgentRole role, String region) {
        return new SwarmAgent(agentId, specialization, role, region);
    }
}
