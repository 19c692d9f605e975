package com.decisionswarm.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of work a swarm performs. The wire name is the snake_case form used in
 * prompts, task ids and serialized traces.
 */
public enum TaskType {

    INTENT_CLASSIFICATION("intent_classification"),
    DATA_ANALYSIS("data_analysis"),
    MODEL_BUILDING("model_building"),
    SOLUTION_SOLVING("solution_solving");

    private final String wireName;

    TaskType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
