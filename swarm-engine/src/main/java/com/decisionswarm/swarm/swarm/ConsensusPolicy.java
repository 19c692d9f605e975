package com.decisionswarm.swarm.swarm;

import com.decisionswarm.common.consensus.ConsensusEngine;
import com.decisionswarm.common.consensus.HighestConfidenceConsensusStrategy;
import com.decisionswarm.common.consensus.MajorityVoteConsensusStrategy;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.swarm.parse.ResponseSchema;

/**
 * Picks the consensus engine for a stage from its response schema: categorical stages
 * vote on the label field, structured stages take the most confident proposal and
 * measure agreement on the compatibility field, if the schema has one.
 */
public final class ConsensusPolicy {

    private ConsensusPolicy() {}

    public static ConsensusEngine engineFor(Stage stage) {
        ResponseSchema schema = ResponseSchema.forTaskType(stage.taskType());
        return switch (schema.consensusKind()) {
            case CATEGORICAL -> new MajorityVoteConsensusStrategy(schema.keyField());
            case STRUCTURED -> new HighestConfidenceConsensusStrategy(schema.keyField());
        };
    }
}
