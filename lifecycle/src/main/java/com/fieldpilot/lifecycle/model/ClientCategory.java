package com.fieldpilot.lifecycle.model;

/**
 * CRM classification of a client. A client becomes ACTIVE once a job is
 * completed for them and drops back to POTENTIAL when their only live job
 * is cancelled.
 */
public enum ClientCategory {
    POTENTIAL,
    ACTIVE
}
