package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.statemachine.TransitionResult;

import java.time.Instant;
import java.util.UUID;

public record TransitionResponse(UUID jobId, String fromState, String state, UUID transitionId, Instant appliedAt) {

    public static TransitionResponse from(TransitionResult r) {
        return new TransitionResponse(r.jobId(), r.fromState().wireName(), r.state().wireName(),
                r.transitionId(), r.appliedAt());
    }
}
