package com.decisionswarm.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StageStatus {

    SUCCESS("success"),
    FAILED("failed");

    private final String wireName;

    StageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
