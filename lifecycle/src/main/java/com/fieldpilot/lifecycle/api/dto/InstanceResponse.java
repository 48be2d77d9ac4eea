package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.model.RecurringInstance;

import java.time.LocalDate;
import java.util.UUID;

public record InstanceResponse(UUID id, UUID seriesId, LocalDate occurrenceDate, String status, UUID jobId) {

    public static InstanceResponse from(RecurringInstance i) {
        return new InstanceResponse(i.getId(), i.getSeriesId(), i.getOccurrenceDate(), i.getStatus().name(), i.getJobId());
    }
}
