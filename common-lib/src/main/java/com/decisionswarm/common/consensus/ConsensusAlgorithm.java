package com.decisionswarm.common.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

/** Identifier recorded in {@link ConsensusResult#algorithmUsed()}. */
public enum ConsensusAlgorithm {

    MAJORITY_VOTE("majority_vote"),
    HIGHEST_CONFIDENCE("highest_confidence");

    private final String wireName;

    ConsensusAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
