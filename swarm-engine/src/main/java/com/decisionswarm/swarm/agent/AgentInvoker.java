package com.decisionswarm.swarm.agent;

import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Executes one task on one agent.
 *
 * <p>The returned {@code Mono} always emits exactly one {@link AgentOutcome} and never
 * errors; every failure is reported through {@link AgentOutcome#status()}.
 */
public interface AgentInvoker {

    Mono<AgentOutcome> invoke(SwarmAgent agent, Task task, Duration agentTimeout);
}
