package com.decisionswarm.swarm.swarm;

import com.decisionswarm.common.consensus.ConsensusAggregator;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.swarm.dispatch.AgentDispatchService;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SwarmFactory {

    private final AgentDispatchService dispatchService;

    public SwarmFactory(AgentDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    public Swarm create(Stage stage, List<SwarmAgent> agents) {
        return new Swarm(swarmId(stage), stage, agents,
            new ConsensusAggregator(ConsensusPolicy.engineFor(stage)), dispatchService);
    }

    public static String swarmId(Stage stage) {
        return stage.swarmId();
    }
}
