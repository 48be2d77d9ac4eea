package com.fieldpilot.lifecycle.api.dto;

/** Request body for POST /jobs/{id}/transitions. {@code toState} takes "in_progress" or "IN_PROGRESS". */
public record TransitionRequest(String toState, String reason) {}
