package com.decisionswarm.orchestrator.service;

import com.decisionswarm.common.model.PipelineResult;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.trace.TraceContextUtil;
import com.decisionswarm.orchestrator.config.PipelineConfig;
import com.decisionswarm.orchestrator.logger.PipelineFlowLogger;
import com.decisionswarm.orchestrator.pipeline.SwarmPipelineEngine;
import com.decisionswarm.swarm.swarm.ConsensusPolicy;
import com.decisionswarm.swarm.swarm.SwarmFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for pipeline runs: resolves the run configuration, assigns the run id and
 * hands over to {@link SwarmPipelineEngine}.
 */
@Service
public class OrchestratorService {

    private final SwarmPipelineEngine pipelineEngine;
    private final PipelineConfig defaultConfig;
    private final PipelineFlowLogger flowLogger;

    public OrchestratorService(SwarmPipelineEngine pipelineEngine,
                               PipelineConfig defaultPipelineConfig,
                               PipelineFlowLogger flowLogger) {
        this.pipelineEngine = pipelineEngine;
        this.defaultConfig = defaultPipelineConfig;
        this.flowLogger = flowLogger;
    }

    /**
     * Runs the pipeline with the default configuration, optionally overriding timeouts and
     * per-stage quorum. Invalid input fails the returned {@code Mono} with
     * {@link IllegalArgumentException} before any swarm is dispatched.
     */
    public Mono<PipelineResult> run(String query, Long agentTimeoutMs, Long stageTimeoutMs,
                                    Map<String, Integer> minQuorum) {
        return Mono.fromCallable(() -> resolveConfig(agentTimeoutMs, stageTimeoutMs, minQuorum))
            .flatMap(config -> run(query, config));
    }

    public Mono<PipelineResult> run(String query, PipelineConfig config) {
        if (query == null || query.isBlank()) {
            return Mono.error(new IllegalArgumentException("query must not be blank"));
        }
        String runId = UUID.randomUUID().toString();
        flowLogger.runReceived(runId, query);
        return TraceContextUtil.withRunId(pipelineEngine.runPipeline(query, config), runId);
    }

    public List<SwarmStatus> swarmStatus() {
        List<SwarmStatus> statuses = new ArrayList<>();
        for (Stage stage : Stage.values()) {
            List<SwarmAgent> agents = defaultConfig.rosterFor(stage);
            statuses.add(new SwarmStatus(
                stage,
                SwarmFactory.swarmId(stage),
                agents.size(),
                defaultConfig.quorumFor(stage),
                ConsensusPolicy.engineFor(stage).algorithm().wireName(),
                agents.stream().map(SwarmAgent::region).distinct().sorted().toList(),
                agents.stream().map(SwarmAgent::specialization).toList()));
        }
        return statuses;
    }

    PipelineConfig resolveConfig(Long agentTimeoutMs, Long stageTimeoutMs, Map<String, Integer> minQuorum) {
        Map<Stage, Integer> quorum = null;
        if (minQuorum != null && !minQuorum.isEmpty()) {
            quorum = new EnumMap<>(Stage.class);
            for (Map.Entry<String, Integer> entry : minQuorum.entrySet()) {
                if (entry.getValue() == null) {
                    throw new IllegalArgumentException("minQuorum for " + entry.getKey() + " is null");
                }
                quorum.put(PipelineConfig.parseStage(entry.getKey()), entry.getValue());
            }
        }
        return defaultConfig.withOverrides(
            agentTimeoutMs != null ? Duration.ofMillis(agentTimeoutMs) : null,
            stageTimeoutMs != null ? Duration.ofMillis(stageTimeoutMs) : null,
            quorum);
    }
}
