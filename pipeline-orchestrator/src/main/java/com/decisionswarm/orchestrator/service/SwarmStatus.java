package com.decisionswarm.orchestrator.service;

import com.decisionswarm.common.model.Stage;

import java.util.List;

/** Read-only view of one configured swarm. */
public record SwarmStatus(
    Stage stage,
    String swarmId,
    int agentCount,
    int minQuorum,
    String consensusAlgorithm,
    List<String> regions,
    List<String> specializations
) {}
