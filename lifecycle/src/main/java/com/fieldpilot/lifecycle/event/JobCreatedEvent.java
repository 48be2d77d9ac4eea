package com.fieldpilot.lifecycle.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A job was opened in Draft by job intake. */
public record JobCreatedEvent(
        UUID    eventId,
        UUID    jobId,
        UUID    clientId,
        Instant occurredAt) implements LifecycleEvent {

    @Override
    public String type() {
        return JOB_CREATED;
    }

    @Override
    public Map<String, Object> payload() {
        return Map.of("jobId", jobId.toString(), "clientId", clientId.toString());
    }
}
