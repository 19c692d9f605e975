package com.decisionswarm.common.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why a stage produced no consensus. */
public enum FailureReason {

    /** Too few ok outcomes to aggregate. */
    INSUFFICIENT_QUORUM("insufficient_quorum"),

    /** Unexpected error while preparing or running the stage. */
    STAGE_ERROR("stage_error");

    private final String wireName;

    FailureReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
