package com.fieldpilot.lifecycle.model;

/**
 * Outcome of one automation rule firing.
 *
 *   Matched → Executing → SUCCEEDED | PARTIALLY_FAILED | FAILED
 *   Matched → RATE_LIMITED (firing guard exceeded, nothing executed)
 */
public enum RunStatus {
    SUCCEEDED,
    PARTIALLY_FAILED,
    FAILED,
    RATE_LIMITED
}
