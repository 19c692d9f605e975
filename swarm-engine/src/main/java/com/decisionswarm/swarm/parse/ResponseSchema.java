package com.decisionswarm.swarm.parse;

import com.decisionswarm.common.model.TaskType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Expected completion shape per task type. Each schema names its required fields, the
 * field consensus is computed on, and the JSON template shown to agents in the prompt.
 */
public enum ResponseSchema {

    INTENT(TaskType.INTENT_CLASSIFICATION, ConsensusKind.CATEGORICAL, "intent",
        Map.of("intent", Field.TEXT, "confidence", Field.NUMBER),
        """
        {
          "intent": "<primary intent label, e.g. production_scheduling>",
          "confidence": <number between 0.0 and 1.0>,
          "reasoning": "<one or two sentences>"
        }"""),

    DATA(TaskType.DATA_ANALYSIS, ConsensusKind.STRUCTURED, null,
        Map.of("data_entities", Field.ARRAY, "confidence", Field.NUMBER),
        """
        {
          "data_entities": ["<entity the model needs>", "..."],
          "sample_data": { "<entity>": "<representative values>" },
          "assumptions": ["<assumption>", "..."],
          "confidence": <number between 0.0 and 1.0>
        }"""),

    MODEL(TaskType.MODEL_BUILDING, ConsensusKind.STRUCTURED, "model_type",
        Map.of("model_type", Field.TEXT, "confidence", Field.NUMBER),
        """
        {
          "model_type": "<linear_programming | mixed_integer_programming | nonlinear_programming | constraint_programming>",
          "decision_variables": ["<variable definition>", "..."],
          "constraints": ["<constraint>", "..."],
          "objective": "<objective function>",
          "confidence": <number between 0.0 and 1.0>
        }"""),

    SOLVER(TaskType.SOLUTION_SOLVING, ConsensusKind.STRUCTURED, "status",
        Map.of("status", Field.TEXT, "confidence", Field.NUMBER),
        """
        {
          "status": "<optimal | feasible | infeasible | unbounded>",
          "recommended_solver": "<solver name>",
          "objective_value": <number or null>,
          "solution": { "<variable>": <value> },
          "confidence": <number between 0.0 and 1.0>
        }""");

    /** How the stage's consensus treats the compared field. */
    public enum ConsensusKind {
        CATEGORICAL,
        STRUCTURED
    }

    enum Field {
        TEXT(node -> node.isTextual() && !node.asText().isBlank()),
        NUMBER(JsonNode::isNumber),
        ARRAY(JsonNode::isArray);

        private final Predicate<JsonNode> check;

        Field(Predicate<JsonNode> check) {
            this.check = check;
        }

        boolean accepts(JsonNode node) {
            return node != null && !node.isNull() && check.test(node);
        }
    }

    public static final String CONFIDENCE_FIELD = "confidence";

    private final TaskType taskType;
    private final ConsensusKind consensusKind;
    private final String keyField;
    private final Map<String, Field> requiredFields;
    private final String template;

    ResponseSchema(TaskType taskType, ConsensusKind consensusKind, String keyField,
                   Map<String, Field> requiredFields, String template) {
        this.taskType = taskType;
        this.consensusKind = consensusKind;
        this.keyField = keyField;
        this.requiredFields = requiredFields;
        this.template = template;
    }

    public TaskType taskType() {
        return taskType;
    }

    public ConsensusKind consensusKind() {
        return consensusKind;
    }

    /**
     * Label field for categorical stages, compatibility field for structured ones;
     * {@code null} when a structured stage has no notion of compatible proposals.
     */
    public String keyField() {
        return keyField;
    }

    public String template() {
        return template;
    }

    /** Required field names in a stable order, for error messages. */
    public List<String> requiredFieldNames() {
        return requiredFields.keySet().stream().sorted().toList();
    }

    Map<String, Field> requiredFields() {
        return requiredFields;
    }

    public static ResponseSchema forTaskType(TaskType taskType) {
        for (ResponseSchema schema : values()) {
            if (schema.taskType == taskType) {
                return schema;
            }
        }
        throw new IllegalArgumentException("No response schema for task type " + taskType);
    }
}
