package com.decisionswarm.swarm.prompt;

import com.decisionswarm.common.model.AgentRole;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.model.TaskType;
import com.decisionswarm.swarm.parse.ResponseSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptFactoryTest {

    private final PromptFactory factory = new PromptFactory(new ObjectMapper());

    private final SwarmAgent formulationAgent =
        SwarmAgent.of("formulation_agent", "mathematical_formulation", AgentRole.MODEL_BUILDER, "us-east-1");

    @Test
    @DisplayName("same inputs give the same prompt regardless of payload insertion order")
    void deterministic() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("query", "minimize changeover time");
        first.put("intent_result", Map.of("intent", "production_scheduling"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("intent_result", Map.of("intent", "production_scheduling"));
        second.put("query", "minimize changeover time");

        String a = factory.build(formulationAgent, Task.create(TaskType.MODEL_BUILDING, first));
        String b = factory.build(formulationAgent, Task.create(TaskType.MODEL_BUILDING, second));

        assertEquals(a, b);
    }

    @Test
    @DisplayName("prompt carries the specialization focus, the payload and the schema")
    void content() {
        String prompt = factory.build(formulationAgent,
            Task.create(TaskType.MODEL_BUILDING, Map.of("query", "plan two shifts")));

        assertTrue(prompt.contains("mathematical modeler"));
        assertTrue(prompt.contains("decision variables and their domains"));
        assertTrue(prompt.contains("plan two shifts"));
        assertTrue(prompt.endsWith(ResponseSchema.MODEL.template()));
    }

    @Test
    @DisplayName("unknown specialization falls back to the task type brief")
    void fallbackBrief() {
        SpecializationBrief brief = PromptFactory.briefFor("astrology", TaskType.INTENT_CLASSIFICATION);

        assertEquals("a manufacturing optimization analyst", brief.expertise());
        assertNotNull(PromptFactory.briefFor("or_tools_scip", TaskType.SOLUTION_SOLVING));
    }
}
