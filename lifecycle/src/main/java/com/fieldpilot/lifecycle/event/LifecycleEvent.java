package com.fieldpilot.lifecycle.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Fact published after a committed change in the job lifecycle.
 *
 * Events are immutable. {@link #payload()} is the flat view rule conditions
 * are evaluated against; keys are camelCase and enum values use their wire
 * names ("in_progress").
 */
public interface LifecycleEvent {

    String JOB_TRANSITIONED = "job_transitioned";
    String JOB_SCHEDULED    = "job_scheduled";
    String JOB_CREATED      = "job_created";

    UUID eventId();

    UUID jobId();

    Instant occurredAt();

    String type();

    Map<String, Object> payload();
}
