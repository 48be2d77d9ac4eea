package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Minimal invoice row written by the create_draft_invoice action.
 * The full invoicing module lives outside this service; job_id is unique so
 * at most one invoice can ever be created per job.
 *
 * DB table: invoices  (Flyway V4)
 */
@Entity
@Table(name = "invoices")
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, unique = true, updatable = false)
    private UUID jobId;

    @Column(name = "client_id", nullable = false, updatable = false)
    private UUID clientId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceStatus status = InvoiceStatus.DRAFT;

    @Column(nullable = false)
    private BigDecimal amount = BigDecimal.ZERO;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Invoice() {}   // required by JPA

    public Invoice(UUID jobId, UUID clientId, BigDecimal amount, LocalDate dueDate) {
        this.jobId    = jobId;
        this.clientId = clientId;
        this.amount   = amount;
        this.dueDate  = dueDate;
    }

    public UUID          getId()        { return id; }
    public UUID          getJobId()     { return jobId; }
    public UUID          getClientId()  { return clientId; }
    public InvoiceStatus getStatus()    { return status; }
    public BigDecimal    getAmount()    { return amount; }
    public LocalDate     getDueDate()   { return dueDate; }
    public Instant       getCreatedAt() { return createdAt; }

    public void setStatus(InvoiceStatus status) { this.status = status; }
}
