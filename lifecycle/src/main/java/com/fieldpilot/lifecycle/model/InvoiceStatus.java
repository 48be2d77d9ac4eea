package com.fieldpilot.lifecycle.model;

public enum InvoiceStatus {
    DRAFT,
    SENT,
    PAID,
    VOID
}
