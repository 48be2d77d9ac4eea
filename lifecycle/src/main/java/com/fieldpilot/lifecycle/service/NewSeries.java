package com.fieldpilot.lifecycle.service;

import com.fieldpilot.lifecycle.model.RecurrenceFrequency;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

public record NewSeries(
        UUID                clientId,
        UUID                propertyId,
        String              name,
        RecurrenceFrequency frequency,
        Integer             intervalCount,
        DayOfWeek           dayOfWeek,
        Integer             dayOfMonth,
        LocalDate           startDate,
        LocalDate           endDate,
        List<String>        defaultCrew,
        LocalTime           visitStartTime,
        Double              estimatedDurationHours,
        String              notes) {}
