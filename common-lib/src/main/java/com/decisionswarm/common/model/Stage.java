package com.decisionswarm.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four pipeline stages, in execution order. Each stage owns exactly one swarm
 * and one {@link TaskType}.
 */
public enum Stage {

    INTENT("Intent", TaskType.INTENT_CLASSIFICATION),
    DATA("Data", TaskType.DATA_ANALYSIS),
    MODEL("Model", TaskType.MODEL_BUILDING),
    SOLVER("Solver", TaskType.SOLUTION_SOLVING);

    private final String displayName;
    private final TaskType taskType;

    Stage(String displayName, TaskType taskType) {
        this.displayName = displayName;
        this.taskType = taskType;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public TaskType taskType() {
        return taskType;
    }

    /** Payload key under which this stage's consensus value is handed to later stages. */
    public String payloadKey() {
        return name().toLowerCase(Locale.ROOT) + "_result";
    }

    public String swarmId() {
        return name().toLowerCase(Locale.ROOT) + "_swarm";
    }
}
