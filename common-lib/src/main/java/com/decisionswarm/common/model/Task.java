package com.decisionswarm.common.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Unit of work dispatched to one swarm. Created immediately before a stage runs and
 * discarded once that stage completes.
 *
 * <p>The id combines the creation timestamp, a hash of the payload and a random
 * nonce, so two dispatches of identical content in the same millisecond still get
 * distinct ids.
 */
public record Task(
    String taskId,
    TaskType taskType,
    Map<String, Object> payload,
    Instant createdAt
) {

    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    public Task {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Task create(TaskType taskType, Map<String, Object> payload) {
        Instant now = Instant.now();
        String nonce = UUID.randomUUID().toString().substring(0, 8);
        String taskId = String.format("%s_%s_%08x_%s",
            taskType.wireName(), ID_TIMESTAMP.format(now), payload.hashCode(), nonce);
        return new Task(taskId, taskType, payload, now);
    }
}
