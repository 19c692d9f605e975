package com.decisionswarm.orchestrator.controller;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/pipeline/run}. Everything except {@code query} is optional
 * and overrides the configured default for this run only.
 */
public record PipelineRunRequest(
    String query,
    Long agentTimeoutMs,
    Long stageTimeoutMs,
    Map<String, Integer> minQuorum
) {}
