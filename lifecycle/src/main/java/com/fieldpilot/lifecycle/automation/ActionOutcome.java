package com.fieldpilot.lifecycle.automation;

/** One entry of an AutomationRun's action results. */
public record ActionOutcome(String action, boolean success, String detail, long durationMs) {}
