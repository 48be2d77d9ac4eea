package com.fieldpilot.lifecycle.automation.gateway;

import com.fieldpilot.lifecycle.model.Invoice;
import com.fieldpilot.lifecycle.model.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/** Boundary to the invoicing module. At most one invoice exists per job. */
public interface InvoiceGateway {

    Optional<Invoice> findByJob(UUID jobId);

    /**
     * Insert a DRAFT invoice for the job.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if one already exists
     */
    Invoice createDraft(UUID jobId, UUID clientId, BigDecimal amount, LocalDate dueDate);

    Invoice updateStatus(Invoice invoice, InvoiceStatus status);
}
