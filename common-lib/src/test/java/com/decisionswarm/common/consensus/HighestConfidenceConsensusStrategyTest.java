package com.decisionswarm.common.consensus;

import com.decisionswarm.common.model.AgentOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HighestConfidenceConsensusStrategyTest {

    @Test
    @DisplayName("selects the most confident proposal and scores agreement on the compatibility field")
    void compatibilityFieldAgreement() {
        HighestConfidenceConsensusStrategy strategy = new HighestConfidenceConsensusStrategy("model_type");
        List<AgentOutcome> ok = List.of(
            AgentOutcome.ok("constraint_agent", Map.of("model_type", "MILP", "constraints", List.of("c1")), 0.7, 1),
            AgentOutcome.ok("formulation_agent", Map.of("model_type", "milp", "constraints", List.of("c1", "c2")), 0.9, 1),
            AgentOutcome.ok("research_agent", Map.of("model_type", "lp"), 0.8, 1),
            AgentOutcome.ok("solver_compat_agent", Map.of("model_type", "milp"), 0.5, 1));

        ConsensusResult result = strategy.compute(ok);

        assertEquals(List.of("c1", "c2"), result.consensusValue().get("constraints"));
        assertEquals(0.75, result.agreementScore(), 1e-9);
        // contributors: 0.7, 0.9, 0.5
        assertEquals(0.75 * 0.7, result.confidence(), 1e-9);
        assertEquals(ConsensusAlgorithm.HIGHEST_CONFIDENCE, result.algorithmUsed());
        assertEquals(4, result.participatingAgents().size());
    }

    @Test
    @DisplayName("without a compatibility field agreement is 1/|ok|")
    void noCompatibilityField() {
        HighestConfidenceConsensusStrategy strategy = new HighestConfidenceConsensusStrategy(null);
        List<AgentOutcome> ok = List.of(
            AgentOutcome.ok("business_context_agent", Map.of("data_entities", List.of("orders")), 0.6, 1),
            AgentOutcome.ok("data_requirements_agent", Map.of("data_entities", List.of("machines")), 0.8, 1));

        ConsensusResult result = strategy.compute(ok);

        assertEquals(List.of("machines"), result.consensusValue().get("data_entities"));
        assertEquals(0.5, result.agreementScore(), 1e-9);
        assertEquals(0.4, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("equal confidence: smallest agent id is selected")
    void tieOnConfidence() {
        HighestConfidenceConsensusStrategy strategy = new HighestConfidenceConsensusStrategy("status");
        List<AgentOutcome> ok = List.of(
            AgentOutcome.ok("scip_agent", Map.of("status", "optimal", "recommended_solver", "scip"), 0.85, 1),
            AgentOutcome.ok("glop_agent", Map.of("status", "optimal", "recommended_solver", "glop"), 0.85, 1));

        ConsensusResult result = strategy.compute(ok);

        assertEquals("glop", result.consensusValue().get("recommended_solver"));
        assertEquals(1.0, result.agreementScore(), 1e-9);
        assertEquals(0.85, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("selection without the compatibility field counts only itself")
    void selectionMissingCompatibilityField() {
        HighestConfidenceConsensusStrategy strategy = new HighestConfidenceConsensusStrategy("status");
        List<AgentOutcome> ok = List.of(
            AgentOutcome.ok("a", Map.of("objective_value", 10), 0.9, 1),
            AgentOutcome.ok("b", Map.of("status", "optimal"), 0.4, 1));

        ConsensusResult result = strategy.compute(ok);

        assertEquals(0.5, result.agreementScore(), 1e-9);
        assertEquals(0.45, result.confidence(), 1e-9);
    }
}
