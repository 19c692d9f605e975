package com.decisionswarm.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Canonical per-agent result status. Every agent failure mode maps to exactly one value. */
public enum OutcomeStatus {

    OK("ok"),
    TIMEOUT("timeout"),
    TRANSPORT_ERROR("transport_error"),
    MALFORMED_OUTPUT("malformed_output");

    private final String wireName;

    OutcomeStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Failures that may succeed on a second attempt. Malformed output never does. */
    public boolean isRetryable() {
        return this == TIMEOUT || this == TRANSPORT_ERROR;
    }
}
