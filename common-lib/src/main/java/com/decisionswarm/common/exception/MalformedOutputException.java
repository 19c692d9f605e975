package com.decisionswarm.common.exception;

/** The endpoint answered, but the completion does not match the task type's schema. */
public class MalformedOutputException extends AgentException {

    public MalformedOutputException(String agentId, String message) {
        super(agentId, message);
    }

    public MalformedOutputException(String agentId, String message, Throwable cause) {
        super(agentId, message, cause);
    }
}
