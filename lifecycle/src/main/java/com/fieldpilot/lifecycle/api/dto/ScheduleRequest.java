package com.fieldpilot.lifecycle.api.dto;

import java.time.Instant;
import java.util.List;

/** Request body for PUT /jobs/{id}/schedule. A null crew keeps the current one. */
public record ScheduleRequest(Instant scheduledStart, Instant scheduledEnd, List<String> assignedCrew) {}
