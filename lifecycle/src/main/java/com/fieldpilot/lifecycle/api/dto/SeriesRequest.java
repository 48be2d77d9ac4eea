package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.model.RecurrenceFrequency;
import com.fieldpilot.lifecycle.service.NewSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /recurring-series.
 *
 * Required: clientId, name, frequency, startDate
 * Optional: intervalCount (default 1), dayOfWeek ("MONDAY", weekly only),
 *   dayOfMonth (1-31, monthly/quarterly/yearly), endDate, defaultCrew,
 *   visitStartTime (default 08:00), estimatedDurationHours, notes
 */
public record SeriesRequest(UUID clientId, UUID propertyId, String name, RecurrenceFrequency frequency,
                            Integer intervalCount, DayOfWeek dayOfWeek, Integer dayOfMonth,
                            LocalDate startDate, LocalDate endDate, List<String> defaultCrew,
                            LocalTime visitStartTime, Double estimatedDurationHours, String notes) {

    public NewSeries toNewSeries() {
        return new NewSeries(clientId, propertyId, name, frequency, intervalCount, dayOfWeek, dayOfMonth,
                startDate, endDate, defaultCrew, visitStartTime, estimatedDurationHours, notes);
    }
}
