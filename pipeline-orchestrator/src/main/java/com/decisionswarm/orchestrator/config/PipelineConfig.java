package com.decisionswarm.orchestrator.config;

import com.decisionswarm.common.model.Stage;
import com.decisionswarm.common.model.SwarmAgent;
import com.decisionswarm.orchestrator.config.SwarmProperties.AgentEntry;
import com.decisionswarm.swarm.swarm.StageSettings;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration of one pipeline run. Validated on construction; an invalid
 * combination raises {@link IllegalArgumentException}.
 *
 * <ul>
 *   <li>every stage has a roster of 1 to {@value #MAX_SWARM_SIZE} agents with unique ids</li>
 *   <li>both timeouts are positive</li>
 *   <li>every stage quorum is at least 1 and at most the roster size</li>
 * </ul>
 */
public record PipelineConfig(
    Duration agentTimeout,
    Duration stageTimeout,
    Map<Stage, Integer> minQuorum,
    Map<Stage, List<SwarmAgent>> roster
) {
    public static final int MAX_SWARM_SIZE = 6;

    public PipelineConfig {
        requirePositive("agentTimeout", agentTimeout);
        requirePositive("stageTimeout", stageTimeout);
        if (roster == null) {
            throw new IllegalArgumentException("roster is required");
        }
        Map<Stage, List<SwarmAgent>> rosterCopy = new EnumMap<>(Stage.class);
        Map<Stage, Integer> quorumCopy = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            List<SwarmAgent> agents = roster.get(stage);
            validateRoster(stage, agents);
            rosterCopy.put(stage, List.copyOf(agents));

            Integer quorum = minQuorum == null ? null : minQuorum.get(stage);
            int effective = quorum == null ? 1 : quorum;
            if (effective < 1) {
                throw new IllegalArgumentException(stage.displayName() + " quorum must be at least 1, got " + effective);
            }
            if (effective > agents.size()) {
                throw new IllegalArgumentException(stage.displayName() + " quorum " + effective
                    + " exceeds roster size " + agents.size());
            }
            quorumCopy.put(stage, effective);
        }
        roster = Collections.unmodifiableMap(rosterCopy);
        minQuorum = Collections.unmodifiableMap(quorumCopy);
    }

    public List<SwarmAgent> rosterFor(Stage stage) {
        return roster.get(stage);
    }

    public int quorumFor(Stage stage) {
        return minQuorum.get(stage);
    }

    public StageSettings settingsFor(Stage stage) {
        return new StageSettings(agentTimeout, stageTimeout, quorumFor(stage));
    }

    /** Copy with the given values replaced; {@code null} keeps the current value. */
    public PipelineConfig withOverrides(Duration agentTimeout, Duration stageTimeout,
                                        Map<Stage, Integer> quorumOverrides) {
        Map<Stage, Integer> quorum = new EnumMap<>(minQuorum);
        if (quorumOverrides != null) {
            quorum.putAll(quorumOverrides);
        }
        return new PipelineConfig(
            agentTimeout != null ? agentTimeout : this.agentTimeout,
            stageTimeout != null ? stageTimeout : this.stageTimeout,
            quorum,
            roster);
    }

    public static PipelineConfig from(SwarmProperties properties) {
        Map<Stage, List<SwarmAgent>> roster = new EnumMap<>(Stage.class);
        Map<Stage, Integer> quorum = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            String key = stage.name().toLowerCase(Locale.ROOT);
            List<AgentEntry> entries = SwarmProperties.copyOf(properties.getRoster().get(key));
            roster.put(stage, entries.stream()
                .map(e -> toAgent(stage, e))
                .toList());
            Integer q = properties.getMinQuorum().get(key);
            if (q != null) {
                quorum.put(stage, q);
            }
        }
        return new PipelineConfig(properties.getAgentTimeout(), properties.getStageTimeout(), quorum, roster);
    }

    /** Parses a stage key such as {@code "data"} or {@code "Data"}. */
    public static Stage parseStage(String key) {
        for (Stage stage : Stage.values()) {
            if (stage.name().equalsIgnoreCase(key.trim())) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + key);
    }

    private static SwarmAgent toAgent(Stage stage, AgentEntry entry) {
        if (entry.getAgentId() == null || entry.getSpecialization() == null
                || entry.getRole() == null || entry.getRegion() == null) {
            throw new IllegalArgumentException(stage.displayName()
                + " roster entry needs agent-id, specialization, role and region: " + entry.getAgentId());
        }
        return SwarmAgent.of(entry.getAgentId(), entry.getSpecialization(), entry.getRole(), entry.getRegion());
    }

    private static void validateRoster(Stage stage, List<SwarmAgent> agents) {
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException(stage.displayName() + " roster is empty");
        }
        if (agents.size() > MAX_SWARM_SIZE) {
            throw new IllegalArgumentException(stage.displayName() + " roster has " + agents.size()
                + " agents, at most " + MAX_SWARM_SIZE + " allowed");
        }
        Set<String> ids = new HashSet<>();
        for (SwarmAgent agent : agents) {
            if (!ids.add(agent.agentId())) {
                throw new IllegalArgumentException("Duplicate agent id in " + stage.displayName()
                    + " roster: " + agent.agentId());
            }
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
