package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.model.JobState;

import java.time.Instant;
import java.util.UUID;

/** What RequestTransition returns once the state and audit row have committed. */
public record TransitionResult(
        UUID     jobId,
        JobState fromState,
        JobState state,
        UUID     transitionId,
        Instant  appliedAt) {}
