package com.decisionswarm.common.model;

/**
 * Trace entry for one agent in one stage: what happened and how long it took.
 * Unlike {@link AgentOutcome} it carries no proposed value, so it is safe to keep in
 * the pipeline result.
 */
public record AgentReport(
    String agentId,
    String region,
    OutcomeStatus status,
    Double rawConfidence,
    long latencyMs,
    String detail
) {
    public static AgentReport of(SwarmAgent agent, AgentOutcome outcome) {
        return new AgentReport(agent.agentId(), agent.region(), outcome.status(),
            outcome.rawConfidence(), outcome.latencyMs(), outcome.detail());
    }
}
