package com.decisionswarm.orchestrator;

import com.decisionswarm.common.model.Stage;
import com.decisionswarm.orchestrator.config.PipelineConfig;
import com.decisionswarm.swarm.llm.InferenceProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SwarmOrchestratorApplicationTests {

    @Autowired
    private PipelineConfig defaultPipelineConfig;

    @Autowired
    private InferenceProperties inferenceProperties;

    @Test
    void defaultRostersAreBound() {
        assertEquals(5, defaultPipelineConfig.rosterFor(Stage.INTENT).size());
        assertEquals(3, defaultPipelineConfig.rosterFor(Stage.DATA).size());
        assertEquals(4, defaultPipelineConfig.rosterFor(Stage.MODEL).size());
        assertEquals(6, defaultPipelineConfig.rosterFor(Stage.SOLVER).size());
        assertEquals(3, defaultPipelineConfig.quorumFor(Stage.INTENT));
        assertEquals(Duration.ofSeconds(20), defaultPipelineConfig.agentTimeout());
        assertEquals("glop_agent", defaultPipelineConfig.rosterFor(Stage.SOLVER).get(0).agentId());
    }

    @Test
    void inferenceRegionsAreBound() {
        assertEquals(6, inferenceProperties.getRegions().size());
        assertNotNull(inferenceProperties.resolveEndpoint("ap-southeast-1"));
        assertEquals(Duration.ofMillis(500), inferenceProperties.getRetryBackoff());
    }
}
