package com.fieldpilot.lifecycle.service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** What job intake (quote conversion) hands over when a job is opened. */
public record NewJob(
        UUID         clientId,
        UUID         propertyId,
        String       title,
        Instant      scheduledStart,
        Instant      scheduledEnd,
        List<String> assignedCrew,
        String       costPayload) {

    public NewJob {
        if (clientId == null) throw new IllegalArgumentException("clientId is required");
        if (title == null || title.isBlank()) throw new IllegalArgumentException("title is required");
        assignedCrew = assignedCrew == null ? List.of() : List.copyOf(assignedCrew);
    }
}
