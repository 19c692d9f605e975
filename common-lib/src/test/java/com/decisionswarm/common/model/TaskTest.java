package com.decisionswarm.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    @DisplayName("identical content dispatched twice gets distinct ids")
    void taskIdsAreUniquePerDispatch() {
        Map<String, Object> payload = Map.of("query", "schedule line 3");

        Task first = Task.create(TaskType.INTENT_CLASSIFICATION, payload);
        Task second = Task.create(TaskType.INTENT_CLASSIFICATION, payload);

        assertNotEquals(first.taskId(), second.taskId());
        assertTrue(first.taskId().startsWith("intent_classification_"));
    }

    @Test
    @DisplayName("payload is read-only")
    void payloadImmutable() {
        Task task = Task.create(TaskType.DATA_ANALYSIS, Map.of("query", "q"));
        assertThrows(UnsupportedOperationException.class, () -> task.payload().put("x", 1));
    }

    @Test
    @DisplayName("stage payload keys and task types line up")
    void stageMapping() {
        assertEquals("intent_result", Stage.INTENT.payloadKey());
        assertEquals("solver_result", Stage.SOLVER.payloadKey());
        assertEquals(TaskType.MODEL_BUILDING, Stage.MODEL.taskType());
        assertEquals("Data", Stage.DATA.displayName());
    }
}
