package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.automation.ActionOutcome;
import com.fieldpilot.lifecycle.model.AutomationRun;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RunResponse(
        UUID                id,
        UUID                ruleId,
        String              ruleName,
        UUID                eventId,
        String              eventType,
        UUID                jobId,
        String              status,
        List<ActionOutcome> actionResults,
        Instant             firedAt,
        Instant             completedAt
) {
    public static RunResponse from(AutomationRun run, List<ActionOutcome> outcomes) {
        return new RunResponse(run.getId(), run.getRuleId(), run.getRuleName(), run.getEventId(),
                run.getEventType(), run.getJobId(), run.getStatus().name(), outcomes,
                run.getFiredAt(), run.getCompletedAt());
    }
}
