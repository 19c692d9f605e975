package com.decisionswarm.swarm.dispatch;

import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.OutcomeStatus;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.trace.TraceContextUtil;
import com.decisionswarm.swarm.agent.AgentInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Fans one task out to every agent of a roster at once and collects exactly one outcome
 * per agent, in roster order.
 *
 * <p>The stage deadline is enforced per agent subscription. Since all subscriptions start
 * together, every agent still running when {@code stageTimeout} elapses is recorded as
 * {@code TIMEOUT} and its in-flight call is cancelled; the returned {@code Mono} does not
 * wait for the cancellation to take effect.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);

    private final AgentInvoker agentInvoker;

    public AgentDispatchService(AgentInvoker agentInvoker) {
        this.agentInvoker = agentInvoker;
    }

    public Mono<List<AgentOutcome>> dispatch(List<SwarmAgent> agents, Task task,
                                             Duration agentTimeout, Duration stageTimeout) {
        if (agents.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.deferContextual(ctx -> {
            String runId = TraceContextUtil.getRunId(ctx);
            TraceContextUtil.withMdc(runId, () ->
                log.info("[Dispatch] {} agents in parallel task={} agentTimeoutMs={} stageTimeoutMs={}",
                    agents.size(), task.taskId(), agentTimeout.toMillis(), stageTimeout.toMillis()));
            long startNanos = System.nanoTime();

            return Flux.fromIterable(agents)
                .flatMapSequential(agent -> agentInvoker.invoke(agent, task, agentTimeout)
                        .timeout(stageTimeout, Mono.fromSupplier(() -> AgentOutcome.failed(agent.agentId(),
                            OutcomeStatus.TIMEOUT, elapsedMillis(startNanos), "stage deadline exceeded")))
                        .onErrorResume(e -> {
                            TraceContextUtil.withMdc(runId, () ->
                                log.error("[Dispatch] agent={} raised instead of reporting an outcome",
                                    agent.agentId(), e));
                            return Mono.just(AgentOutcome.failed(agent.agentId(),
                                OutcomeStatus.TRANSPORT_ERROR, elapsedMillis(startNanos), String.valueOf(e.getMessage())));
                        })
                        .switchIfEmpty(Mono.fromSupplier(() -> AgentOutcome.failed(agent.agentId(),
                            OutcomeStatus.TRANSPORT_ERROR, elapsedMillis(startNanos), "no outcome produced")))
                        .doOnNext(outcome -> TraceContextUtil.withMdc(runId, () ->
                            log.info("[Dispatch] agent={} status={} latencyMs={}",
                                outcome.agentId(), outcome.status().wireName(), outcome.latencyMs()))),
                    agents.size())
                .collectList();
        });
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
