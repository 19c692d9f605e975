package com.decisionswarm.orchestrator.service;

import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.AgentRole;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.orchestrator.config.PipelineConfig;
import com.decisionswarm.orchestrator.logger.PipelineFlowLogger;
import com.decisionswarm.orchestrator.pipeline.SwarmPipelineEngine;
import com.decisionswarm.swarm.dispatch.AgentDispatchService;
import com.decisionswarm.swarm.swarm.SwarmFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorServiceTest {

    private OrchestratorService service;

    @BeforeEach
    void setUp() {
        Map<Stage, List<SwarmAgent>> roster = new EnumMap<>(Stage.class);
        roster.put(Stage.INTENT, List.of(
            SwarmAgent.of("ops_research_agent", "operations_research", AgentRole.INTENT_CLASSIFIER, "us-east-1"),
            SwarmAgent.of("supply_chain_agent", "supply_chain", AgentRole.INTENT_CLASSIFIER, "eu-west-1"),
            SwarmAgent.of("sustainability_agent", "sustainability", AgentRole.INTENT_CLASSIFIER, "us-east-1")));
        roster.put(Stage.DATA, List.of(
            SwarmAgent.of("data_requirements_agent", "data_requirements", AgentRole.DATA_ANALYST, "us-east-1")));
        roster.put(Stage.MODEL, List.of(
            SwarmAgent.of("formulation_agent", "mathematical_formulation", AgentRole.MODEL_BUILDER, "us-east-1")));
        roster.put(Stage.SOLVER, List.of(
            SwarmAgent.of("glop_agent", "or_tools_glop", AgentRole.SOLVER_OPTIMIZER, "us-east-1")));
        PipelineConfig defaults = new PipelineConfig(Duration.ofSeconds(1), Duration.ofSeconds(2),
            Map.of(Stage.INTENT, 2), roster);

        AgentDispatchService dispatch = new AgentDispatchService((agent, task, timeout) ->
            Mono.just(AgentOutcome.ok(agent.agentId(),
                Map.of("intent", "production_scheduling", "data_entities", List.of("orders"),
                    "model_type", "linear_programming", "status", "optimal"), 0.9, 1)));
        PipelineFlowLogger flowLogger = new PipelineFlowLogger();
        SwarmPipelineEngine engine = new SwarmPipelineEngine(new SwarmFactory(dispatch), flowLogger);
        service = new OrchestratorService(engine, defaults, flowLogger);
    }

    @Test
    @DisplayName("run assigns a run id and completes all stages")
    void runCompletes() {
        StepVerifier.create(service.run("plan next week", null, null, null))
            .assertNext(result -> {
                assertTrue(result.overallSuccess());
                assertNotEquals("unknown", result.runId());
                assertEquals(4, result.stages().size());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("blank query is rejected before dispatch")
    void blankQuery() {
        StepVerifier.create(service.run("  ", null, null, null))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    @DisplayName("request overrides are applied on top of the defaults")
    void overrides() {
        PipelineConfig config = service.resolveConfig(500L, 900L, Map.of("Intent", 3, "solver", 1));

        assertEquals(Duration.ofMillis(500), config.agentTimeout());
        assertEquals(Duration.ofMillis(900), config.stageTimeout());
        assertEquals(3, config.quorumFor(Stage.INTENT));
        assertEquals(1, config.quorumFor(Stage.DATA));
    }

    @Test
    @DisplayName("invalid overrides surface as IllegalArgumentException")
    void invalidOverrides() {
        StepVerifier.create(service.run("q", null, null, Map.of("intent", 9)))
            .expectError(IllegalArgumentException.class)
            .verify();
        StepVerifier.create(service.run("q", -1L, null, null))
            .expectError(IllegalArgumentException.class)
            .verify();
        StepVerifier.create(service.run("q", null, null, Map.of("reporting", 1)))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    @DisplayName("swarm status lists every stage with its roster summary")
    void swarmStatus() {
        List<SwarmStatus> statuses = service.swarmStatus();

        assertEquals(4, statuses.size());
        SwarmStatus intent = statuses.get(0);
        assertEquals("intent_swarm", intent.swarmId());
        assertEquals(3, intent.agentCount());
        assertEquals(2, intent.minQuorum());
        assertEquals("majority_vote", intent.consensusAlgorithm());
        assertEquals(List.of("eu-west-1", "us-east-1"), intent.regions());
        assertEquals("highest_confidence", statuses.get(3).consensusAlgorithm());
    }
}
