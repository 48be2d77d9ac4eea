package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.model.RecurringSeries;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

public record SeriesResponse(
        UUID         id,
        UUID         clientId,
        UUID         propertyId,
        String       name,
        String       frequency,
        int          intervalCount,
        DayOfWeek    dayOfWeek,
        Integer      dayOfMonth,
        LocalDate    startDate,
        LocalDate    endDate,
        boolean      active,
        List<String> defaultCrew,
        LocalTime    visitStartTime,
        Double       estimatedDurationHours,
        String       notes
) {
    public static SeriesResponse from(RecurringSeries s) {
        return new SeriesResponse(s.getId(), s.getClientId(), s.getPropertyId(), s.getName(),
                s.getFrequency().name(), s.getIntervalCount(), s.getDayOfWeek(), s.getDayOfMonth(),
                s.getStartDate(), s.getEndDate(), s.isActive(), List.copyOf(s.getDefaultCrew()),
                s.getVisitStartTime(), s.getEstimatedDurationHours(), s.getNotes());
    }
}
