package com.decisionswarm.swarm.prompt;

import java.util.List;

/** Perspective an agent is asked to take: who it is and what it should look at. */
public record SpecializationBrief(String expertise, List<String> focus) {

    public SpecializationBrief {
        focus = List.copyOf(focus);
    }

    static SpecializationBrief of(String expertise, String... focus) {
        return new SpecializationBrief(expertise, List.of(focus));
    }
}
