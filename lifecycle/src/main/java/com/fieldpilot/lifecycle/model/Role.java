package com.fieldpilot.lifecycle.model;

/**
 * Roles an actor can hold when requesting a transition.
 *
 * ADMIN satisfies every transition rule. SYSTEM is used by automation
 * actions and the recurrence generator, never by a human caller.
 */
public enum Role {
    ADMIN,   // Office manager / owner
    SALES,   // Estimators and schedulers
    CREW,    // Field crew members
    SYSTEM   // Automation engine and scheduled processes
}
