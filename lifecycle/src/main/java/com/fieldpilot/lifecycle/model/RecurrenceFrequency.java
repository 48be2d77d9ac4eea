package com.fieldpilot.lifecycle.model;

/** Base period of a recurring series; multiplied by the series interval. */
public enum RecurrenceFrequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY;

    /** Months per period for the month-based frequencies, 0 otherwise. */
    public int months() {
        return switch (this) {
            case MONTHLY   -> 1;
            case QUARTERLY -> 3;
            case YEARLY    -> 12;
            case DAILY, WEEKLY -> 0;
        };
    }
}
