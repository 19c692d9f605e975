package com.decisionswarm.swarm.swarm;

import java.time.Duration;
import java.util.Objects;

/** Per-run knobs for one swarm execution. */
public record StageSettings(Duration agentTimeout, Duration stageTimeout, int minQuorum) {

    public StageSettings {
        Objects.requireNonNull(agentTimeout, "agentTimeout");
        Objects.requireNonNull(stageTimeout, "stageTimeout");
    }
}
