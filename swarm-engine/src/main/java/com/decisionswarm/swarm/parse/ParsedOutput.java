package com.decisionswarm.swarm.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Schema-valid completion: the structured value and the agent's self-reported confidence. */
public record ParsedOutput(Map<String, Object> value, double confidence) {

    public ParsedOutput {
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }
}
