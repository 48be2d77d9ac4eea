package com.fieldpilot.lifecycle.model;

/** Where a recorded transition originated. */
public enum TransitionSource {
    MANUAL,      // API caller
    AUTOMATION,  // request_transition action
    RECURRENCE   // recurrence generator
}
