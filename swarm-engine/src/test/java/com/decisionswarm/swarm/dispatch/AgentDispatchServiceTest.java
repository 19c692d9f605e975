package com.decisionswarm.swarm.dispatch;

import com.decisionswarm.common.model.AgentOutcome;
import com.decisionswarm.common.model.AgentRole;
import com.decisionswarm.common.model.OutcomeStatus;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.common.model.Task;
import com.decisionswarm.common.model.TaskType;
import com.decisionswarm.swarm.agent.AgentInvoker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AgentDispatchServiceTest {

    private static final Duration AGENT_TIMEOUT = Duration.ofSeconds(10);

    private final Task task = Task.create(TaskType.SOLUTION_SOLVING, Map.of("query", "q"));

    private static SwarmAgent agent(String id) {
        return SwarmAgent.of(id, "solution_validation", AgentRole.SOLVER_OPTIMIZER, "us-east-1");
    }

    private static AgentOutcome ok(SwarmAgent agent) {
        return AgentOutcome.ok(agent.agentId(), Map.of("status", "optimal"), 0.9, 1);
    }

    @Test
    @DisplayName("exactly one outcome per agent, in roster order")
    void oneOutcomePerAgent() {
        AgentInvoker invoker = (agent, t, timeout) -> agent.agentId().equals("b")
            ? Mono.just(AgentOutcome.failed("b", OutcomeStatus.MALFORMED_OUTPUT, 3, "bad json"))
            : Mono.delay(Duration.ofMillis(agent.agentId().equals("a") ? 80 : 10)).map(i -> ok(agent));
        AgentDispatchService service = new AgentDispatchService(invoker);

        List<AgentOutcome> outcomes = service
            .dispatch(List.of(agent("a"), agent("b"), agent("c")), task, AGENT_TIMEOUT, Duration.ofSeconds(5))
            .block(Duration.ofSeconds(5));

        assertNotNull(outcomes);
        assertEquals(List.of("a", "b", "c"), outcomes.stream().map(AgentOutcome::agentId).toList());
        assertEquals(OutcomeStatus.MALFORMED_OUTPUT, outcomes.get(1).status());
        assertTrue(outcomes.get(0).isOk());
    }

    @Test
    @DisplayName("never-returning agent is cut off at the stage deadline and cancelled")
    void stageDeadline() {
        AtomicBoolean cancelled = new AtomicBoolean();
        AgentInvoker invoker = (agent, t, timeout) -> agent.agentId().equals("stuck")
            ? Mono.<AgentOutcome>never().doOnCancel(() -> cancelled.set(true))
            : Mono.just(ok(agent));
        AgentDispatchService service = new AgentDispatchService(invoker);
        Duration stageTimeout = Duration.ofMillis(300);

        long start = System.nanoTime();
        List<AgentOutcome> outcomes = service
            .dispatch(List.of(agent("fast"), agent("stuck")), task, AGENT_TIMEOUT, stageTimeout)
            .block(Duration.ofSeconds(5));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.get(0).isOk());
        assertEquals(OutcomeStatus.TIMEOUT, outcomes.get(1).status());
        assertTrue(elapsedMs < 1500, "dispatch held for " + elapsedMs + "ms");
        assertTrue(cancelled.get());
    }

    @Test
    @DisplayName("agents run concurrently, not one after another")
    void parallelFanOut() {
        AgentInvoker invoker = (agent, t, timeout) ->
            Mono.delay(Duration.ofMillis(250)).map(i -> ok(agent));
        AgentDispatchService service = new AgentDispatchService(invoker);
        List<SwarmAgent> roster = List.of(agent("a"), agent("b"), agent("c"), agent("d"), agent("e"), agent("f"));

        long start = System.nanoTime();
        List<AgentOutcome> outcomes = service.dispatch(roster, task, AGENT_TIMEOUT, Duration.ofSeconds(5))
            .block(Duration.ofSeconds(5));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(6, outcomes.size());
        assertTrue(outcomes.stream().allMatch(AgentOutcome::isOk));
        assertTrue(elapsedMs < 1000, "six agents took " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("an invoker that errors is recorded as transport_error")
    void erroringInvokerIsContained() {
        AgentInvoker invoker = (agent, t, timeout) -> Mono.error(new IllegalStateException("bug"));
        AgentDispatchService service = new AgentDispatchService(invoker);

        List<AgentOutcome> outcomes = service.dispatch(List.of(agent("a")), task, AGENT_TIMEOUT, Duration.ofSeconds(1))
            .block(Duration.ofSeconds(5));

        assertEquals(OutcomeStatus.TRANSPORT_ERROR, outcomes.get(0).status());
        assertEquals("bug", outcomes.get(0).detail());
    }
}
