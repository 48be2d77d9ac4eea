package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One projected occurrence of a {@link RecurringSeries}.
 *
 * (series_id, occurrence_date) is unique in the database, which is what
 * makes re-running the generator for the same day harmless.
 *
 * DB table: recurring_instances  (Flyway V3)
 */
@Entity
@Table(name = "recurring_instances",
       uniqueConstraints = @UniqueConstraint(name = "uq_instance_series_date",
                                             columnNames = {"series_id", "occurrence_date"}))
public class RecurringInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "series_id", nullable = false, updatable = false)
    private UUID seriesId;

    @Column(name = "occurrence_date", nullable = false, updatable = false)
    private LocalDate occurrenceDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InstanceStatus status = InstanceStatus.PENDING;

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected RecurringInstance() {}   // required by JPA

    public RecurringInstance(UUID seriesId, LocalDate occurrenceDate) {
        this.seriesId       = seriesId;
        this.occurrenceDate = occurrenceDate;
    }

    /** Link this instance to the job created for it. Only legal once. */
    public void markMaterialized(UUID jobId) {
        if (status != InstanceStatus.PENDING) {
            throw new IllegalStateException("Instance " + id + " is " + status + ", cannot materialize");
        }
        this.status = InstanceStatus.MATERIALIZED;
        this.jobId  = jobId;
    }

    /** Skip or cancel a visit that has not been turned into a job yet. */
    public void close(InstanceStatus closedAs) {
        if (closedAs != InstanceStatus.SKIPPED && closedAs != InstanceStatus.CANCELLED) {
            throw new IllegalArgumentException("Instances can only be closed as SKIPPED or CANCELLED");
        }
        if (status != InstanceStatus.PENDING) {
            throw new IllegalStateException("Instance " + id + " is " + status + ", only PENDING visits can be closed");
        }
        this.status = closedAs;
    }

    public UUID           getId()             { return id; }
    public UUID           getSeriesId()       { return seriesId; }
    public LocalDate      getOccurrenceDate() { return occurrenceDate; }
    public InstanceStatus getStatus()         { return status; }
    public UUID           getJobId()          { return jobId; }
    public Instant        getCreatedAt()      { return createdAt; }
}
