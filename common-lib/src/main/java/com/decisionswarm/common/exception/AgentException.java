package com.decisionswarm.common.exception;

/**
 * Failure attributed to a single agent. Never escapes the invocation adapter: the adapter
 * converts it into an {@link com.decisionswarm.common.model.AgentOutcome} status.
 */
public class AgentException extends RuntimeException {
    private final String agentId;

    public AgentException(String agentId, String message) {
        super("[" + agentId + "] " + message);
        this.agentId = agentId;
    }

    public AgentException(String agentId, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
