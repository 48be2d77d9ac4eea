package com.fieldpilot.lifecycle.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Lifecycle states of a field-service Job.
 *
 * Happy path:
 *   DRAFT → SCHEDULED → EN_ROUTE → ON_SITE → IN_PROGRESS → COMPLETED → INVOICED → PAID
 *
 * PAID and CANCELLED are terminal. Every non-terminal state may move to
 * CANCELLED; the full edge set lives in {@link com.fieldpilot.lifecycle.statemachine.TransitionTable}.
 */
public enum JobState {
    DRAFT("Draft"),
    NEEDS_PERMIT("Needs Permit"),
    WAITING_ON_CLIENT("Waiting on Client"),
    SCHEDULED("Scheduled"),
    EN_ROUTE("En Route"),
    ON_SITE("On Site"),
    WEATHER_HOLD("Weather Hold"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed"),
    INVOICED("Invoiced"),
    PAID("Paid"),
    CANCELLED("Cancelled");

    private final String displayName;

    JobState(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }

    /** snake_case name used in event payloads and rule conditions, e.g. "in_progress". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts either the enum name or the wire name, case-insensitively. */
    public static JobState parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job state must not be blank");
        }
        String normalized = value.trim().replace(' ', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job state: " + value));
    }
}
