package com.decisionswarm.swarm.parse;

import com.decisionswarm.common.exception.MalformedOutputException;
import com.decisionswarm.common.model.TaskType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a raw completion into a {@link ParsedOutput} or rejects it.
 *
 * <p>Models often wrap JSON in Markdown fences or surround it with prose, so the parser
 * strips fences and then takes the first balanced {@code {...}} object. Whatever is found
 * must satisfy the {@link ResponseSchema} of the task type completely; a partially valid
 * object is rejected as a whole.
 */
@Component
public class OutcomeParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OutcomeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedOutput parse(String agentId, TaskType taskType, String completion) {
        if (completion == null || completion.isBlank()) {
            throw new MalformedOutputException(agentId, "empty completion");
        }
        String json = extractJsonObject(stripCodeFences(completion));
        if (json == null) {
            throw new MalformedOutputException(agentId, "no JSON object in completion");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException(agentId, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(root instanceof ObjectNode object)) {
            throw new MalformedOutputException(agentId, "completion is not a JSON object");
        }

        ResponseSchema schema = ResponseSchema.forTaskType(taskType);
        for (Map.Entry<String, ResponseSchema.Field> required : schema.requiredFields().entrySet()) {
            if (!required.getValue().accepts(object.get(required.getKey()))) {
                throw new MalformedOutputException(agentId,
                    "missing or invalid field '" + required.getKey() + "' for " + taskType.wireName()
                        + " (required: " + schema.requiredFieldNames() + ")");
            }
        }

        double confidence = object.get(ResponseSchema.CONFIDENCE_FIELD).asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedOutputException(agentId, "confidence out of range: " + confidence);
        }

        ObjectNode valueNode = object.deepCopy();
        valueNode.remove(ResponseSchema.CONFIDENCE_FIELD);
        Map<String, Object> value = objectMapper.convertValue(valueNode, MAP_TYPE);
        value.values().removeIf(v -> v == null);
        return new ParsedOutput(value, confidence);
    }

    static String stripCodeFences(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return trimmed.substring(3).trim();
        }
        String body = trimmed.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        return (closing >= 0 ? body.substring(0, closing) : body).trim();
    }

    /**
     * First balanced top-level object, counting braces outside string literals only.
     * Returns {@code null} when no opening brace exists or the object never closes.
     */
    static String extractJsonObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
