package com.fieldpilot.lifecycle.model;

/**
 * Status of one projected visit of a recurring series.
 *
 *   PENDING → MATERIALIZED (a Draft job was created for it)
 *   PENDING → SKIPPED | CANCELLED (operator decision, never materialized)
 */
public enum InstanceStatus {
    PENDING,
    MATERIALIZED,
    SKIPPED,
    CANCELLED
}
