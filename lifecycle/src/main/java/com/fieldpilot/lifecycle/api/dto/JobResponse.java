package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record JobResponse(
        UUID         id,
        UUID         clientId,
        UUID         propertyId,
        UUID         seriesId,
        String       title,
        String       state,
        String       stateLabel,
        Instant      scheduledStart,
        Instant      scheduledEnd,
        List<String> assignedCrew,
        Instant      lastTransitionAt,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getClientId(),
                job.getPropertyId(),
                job.getSeriesId(),
                job.getTitle(),
                job.getState().wireName(),
                job.getState().displayName(),
                job.getScheduledStart(),
                job.getScheduledEnd(),
                List.copyOf(job.getAssignedCrew()),
                job.getLastTransitionAt(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
