package com.fieldpilot.lifecycle.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** A recurring-series occurrence was materialized into a Draft job. */
public record JobScheduledEvent(
        UUID      eventId,
        UUID      jobId,
        UUID      clientId,
        UUID      seriesId,
        LocalDate scheduledDate,
        Instant   occurredAt) implements LifecycleEvent {

    @Override
    public String type() {
        return JOB_SCHEDULED;
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("jobId", jobId.toString());
        p.put("clientId", clientId.toString());
        p.put("seriesId", seriesId.toString());
        p.put("scheduledDate", scheduledDate.toString());
        return Collections.unmodifiableMap(p);
    }
}
