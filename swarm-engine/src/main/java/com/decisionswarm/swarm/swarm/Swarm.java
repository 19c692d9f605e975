package com.decisionswarm.swarm.swarm;

import com.decisionswarm.common.consensus.AggregationOutcome;
import com.decisionswarm.common.consensus.ConsensusAggregator;
import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.AgentReport;
import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.trace.TraceContextUtil;
import com.decisionswarm.swarm.dispatch.AgentDispatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named agent group for one stage plus its aggregation policy. Holds no per-run state, so
 * one instance may serve any number of concurrent runs.
 */
public final class Swarm {

    private static final Logger log = LoggerFactory.getLogger(Swarm.class);

    private final String swarmId;
    private final Stage stage;
    private final List<SwarmAgent> agents;
    private final ConsensusAggregator aggregator;
    private final AgentDispatchService dispatchService;

    public Swarm(String swarmId, Stage stage, List<SwarmAgent> agents,
                 ConsensusAggregator aggregator, AgentDispatchService dispatchService) {
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException(stage.displayName() + " swarm needs at least one agent");
        }
        Set<String> ids = new HashSet<>();
        for (SwarmAgent agent : agents) {
            if (!ids.add(agent.agentId())) {
                throw new IllegalArgumentException("Duplicate agent id in " + stage.displayName()
                    + " swarm: " + agent.agentId());
            }
        }
        this.swarmId = swarmId;
        this.stage = stage;
        this.agents = List.copyOf(agents);
        this.aggregator = aggregator;
        this.dispatchService = dispatchService;
    }

    public Mono<SwarmResult> run(Task task, StageSettings settings) {
        if (task.taskType() != stage.taskType()) {
            return Mono.error(new IllegalArgumentException(swarmId + " cannot run " + task.taskType().wireName()));
        }
        return dispatchService.dispatch(agents, task, settings.agentTimeout(), settings.stageTimeout())
            .flatMap(outcomes -> Mono.deferContextual(ctx -> {
                AggregationOutcome aggregation = aggregator.aggregate(outcomes, settings.minQuorum());
                String runId = TraceContextUtil.getRunId(ctx);
                if (aggregation.succeeded()) {
                    TraceContextUtil.withMdc(runId, () ->
                        log.info("[Consensus] {} algorithm={} confidence={} agreement={} participants={}",
                            swarmId, aggregation.consensus().algorithmUsed().wireName(),
                            String.format("%.3f", aggregation.consensus().confidence()),
                            String.format("%.3f", aggregation.consensus().agreementScore()),
                            aggregation.consensus().participatingAgents()));
                } else {
                    TraceContextUtil.withMdc(runId, () ->
                        log.warn("[Consensus] {} failed reason={} detail={}",
                            swarmId, aggregation.failureReason().wireName(), aggregation.failureDetail()));
                }
                return Mono.just(new SwarmResult(swarmId, task, outcomes, reports(outcomes), aggregation));
            }));
    }

    private List<AgentReport> reports(List<AgentOutcome> outcomes) {
        List<AgentReport> reports = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            reports.add(AgentReport.of(agents.get(i), outcomes.get(i)));
        }
        return reports;
    }

    public String swarmId() {
        return swarmId;
    }

    public Stage stage() {
        return stage;
    }

    public List<SwarmAgent> agents() {
        return agents;
    }
}
