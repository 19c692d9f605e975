package com.decisionswarm.orchestrator.pipeline;

import com.decisionswarm.common.model.AgentRole;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.orchestrator.config.PipelineConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class PipelineFixtures {

    private PipelineFixtures() {}

    static List<SwarmAgent> roster(Stage stage, AgentRole role, int size) {
        String[] regions = {"us-east-1", "us-west-2", "eu-west-1", "ap-southeast-1", "us-east-2", "us-west-1"};
        List<SwarmAgent> agents = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            agents.add(SwarmAgent.of(stage.name().toLowerCase() + "_agent_" + i, "generalist", role, regions[i]));
        }
        return agents;
    }

    static PipelineConfig config() {
        Map<Stage, List<SwarmAgent>> roster = new EnumMap<>(Stage.class);
        roster.put(Stage.INTENT, roster(Stage.INTENT, AgentRole.INTENT_CLASSIFIER, 5));
        roster.put(Stage.DATA, roster(Stage.DATA, AgentRole.DATA_ANALYST, 3));
        roster.put(Stage.MODEL, roster(Stage.MODEL, AgentRole.MODEL_BUILDER, 4));
        roster.put(Stage.SOLVER, roster(Stage.SOLVER, AgentRole.SOLVER_OPTIMIZER, 6));
        return new PipelineConfig(Duration.ofSeconds(1), Duration.ofSeconds(2),
            Map.of(Stage.INTENT, 3, Stage.DATA, 1, Stage.MODEL, 1, Stage.SOLVER, 1), roster);
    }
}
