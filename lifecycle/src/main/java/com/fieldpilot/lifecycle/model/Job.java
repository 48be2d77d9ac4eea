package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One unit of schedulable field work.
 *
 * A Job is created in DRAFT by job intake (quote conversion) or by the
 * recurrence generator. After that its state changes only through
 * {@link #transitionTo}, which also produces the audit row, so a state
 * change without an audit record cannot be expressed.
 *
 * Jobs are never deleted; CANCELLED is the soft-retirement state.
 *
 * DB table: jobs  (Flyway V1)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "client_id", nullable = false)
    private UUID clientId;

    @Column(name = "property_id")
    private UUID propertyId;

    // Set when the job was materialized from a recurring series.
    @Column(name = "series_id")
    private UUID seriesId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state = JobState.DRAFT;

    @Column(name = "scheduled_start")
    private Instant scheduledStart;

    @Column(name = "scheduled_end")
    private Instant scheduledEnd;

    @Convert(converter = CrewListConverter.class)
    @Column(name = "assigned_crew")
    private List<String> assignedCrew = new ArrayList<>();

    // Cost/material payload owned by the quoting module; opaque JSON here.
    @Column(name = "cost_payload")
    private String costPayload;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "last_transition_at")
    private Instant lastTransitionAt;

    // Applied transitions so far; numbers the audit rows (added by V6 migration).
    @Column(name = "transition_count", nullable = false)
    private int transitionCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(UUID clientId, String title) {
        this.clientId = clientId;
        this.title    = title;
    }

    // ------------------------------------------------------------------
    // State change
    // ------------------------------------------------------------------

    /**
     * Move this job to {@code target} and build the matching audit row.
     *
     * Legality is the caller's concern (the state machine engine validates
     * against the transition table first); this method only guarantees that
     * the new state and its audit record are produced together.
     */
    public StateTransition transitionTo(JobState target,
                                        Actor actor,
                                        String reason,
                                        TransitionSource source,
                                        String tableVersion,
                                        Instant at) {
        transitionCount++;
        StateTransition audit = new StateTransition(
                id, transitionCount, state, target, actor, reason, source, tableVersion, at);
        this.state            = target;
        this.lastTransitionAt = at;
        return audit;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()               { return id; }
    public UUID         getClientId()         { return clientId; }
    public UUID         getPropertyId()       { return propertyId; }
    public UUID         getSeriesId()         { return seriesId; }
    public String       getTitle()            { return title; }
    public JobState     getState()            { return state; }
    public Instant      getScheduledStart()   { return scheduledStart; }
    public Instant      getScheduledEnd()     { return scheduledEnd; }
    public List<String> getAssignedCrew()     { return assignedCrew == null ? List.of() : assignedCrew; }
    public String       getCostPayload()      { return costPayload; }
    public long         getVersion()          { return version; }
    public Instant      getLastTransitionAt() { return lastTransitionAt; }
    public int          getTransitionCount()  { return transitionCount; }
    public Instant      getCreatedAt()        { return createdAt; }
    public Instant      getUpdatedAt()        { return updatedAt; }

    public void setPropertyId(UUID propertyId)        { this.propertyId = propertyId; }
    public void setSeriesId(UUID seriesId)            { this.seriesId = seriesId; }
    public void setTitle(String title)                { this.title = title; }
    public void setCostPayload(String costPayload)    { this.costPayload = costPayload; }
    public void setAssignedCrew(List<String> crew)    { this.assignedCrew = new ArrayList<>(crew); }

    public void setSchedulingWindow(Instant start, Instant end) {
        this.scheduledStart = start;
        this.scheduledEnd   = end;
    }
}
