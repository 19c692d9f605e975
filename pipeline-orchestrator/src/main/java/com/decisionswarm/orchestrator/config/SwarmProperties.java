package com.decisionswarm.orchestrator.config;

import com.decisionswarm.common.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default pipeline settings ({@code swarm.pipeline.*}). Map keys are lowercase stage
 * names: {@code intent}, {@code data}, {@code model}, {@code solver}.
 */
@Component
@ConfigurationProperties(prefix = "swarm.pipeline")
public class SwarmProperties {

    private Duration agentTimeout = Duration.ofSeconds(20);
    private Duration stageTimeout = Duration.ofSeconds(45);
    private Map<String, Integer> minQuorum = new LinkedHashMap<>();
    private Map<String, List<AgentEntry>> roster = new LinkedHashMap<>();

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public Duration getStageTimeout() {
        return stageTimeout;
    }

    public void setStageTimeout(Duration stageTimeout) {
        this.stageTimeout = stageTimeout;
    }

    public Map<String, Integer> getMinQuorum() {
        return minQuorum;
    }

    public void setMinQuorum(Map<String, Integer> minQuorum) {
        this.minQuorum = minQuorum;
    }

    public Map<String, List<AgentEntry>> getRoster() {
        return roster;
    }

    public void setRoster(Map<String, List<AgentEntry>> roster) {
        this.roster = roster;
    }

    public static class AgentEntry {
        private String agentId;
        private String specialization;
        private AgentRole role;
        private String region;

        public String getAgentId() {
            return agentId;
        }

        public void setAgentId(String agentId) {
            this.agentId = agentId;
        }

        public String getSpecialization() {
            return specialization;
        }

        public void setSpecialization(String specialization) {
            this.specialization = specialization;
        }

        public AgentRole getRole() {
            return role;
        }

        public void setRole(AgentRole role) {
            this.role = role;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }

    static List<AgentEntry> copyOf(List<AgentEntry> entries) {
        return entries == null ? List.of() : new ArrayList<>(entries);
    }
}
