package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one applied job transition.
 *
 * Rows are only ever inserted (by the state machine engine, in the same
 * transaction as the job update). {@code tableVersion} records which
 * transition table was in force, so later table edits do not make old
 * history look illegal. {@code sequenceNo} numbers a job's rows 1, 2, 3...
 * and is the order history is read in; timestamps may tie.
 *
 * DB table: job_state_transitions  (Flyway V1)
 */
@Entity
@Table(name = "job_state_transitions")
public class StateTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private int sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false, updatable = false)
    private JobState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, updatable = false)
    private JobState toState;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", nullable = false, updatable = false)
    private Role actorRole;

    @Column(name = "system_triggered", nullable = false, updatable = false)
    private boolean systemTriggered;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransitionSource source;

    @Column(updatable = false)
    private String reason;

    @Column(name = "table_version", nullable = false, updatable = false)
    private String tableVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected StateTransition() {}   // required by JPA

    StateTransition(UUID jobId, int sequenceNo, JobState fromState, JobState toState, Actor actor,
                    String reason, TransitionSource source, String tableVersion, Instant createdAt) {
        this.jobId           = jobId;
        this.sequenceNo      = sequenceNo;
        this.fromState       = fromState;
        this.toState         = toState;
        this.actorId         = actor.id();
        this.actorRole       = actor.role();
        this.systemTriggered = actor.isSystem();
        this.reason          = reason;
        this.source          = source;
        this.tableVersion    = tableVersion;
        this.createdAt       = createdAt;
    }

    public UUID             getId()              { return id; }
    public UUID             getJobId()           { return jobId; }
    public int              getSequenceNo()      { return sequenceNo; }
    public JobState         getFromState()       { return fromState; }
    public JobState         getToState()         { return toState; }
    public String           getActorId()         { return actorId; }
    public Role             getActorRole()       { return actorRole; }
    public boolean          isSystemTriggered()  { return systemTriggered; }
    public TransitionSource getSource()          { return source; }
    public String           getReason()          { return reason; }
    public String           getTableVersion()    { return tableVersion; }
    public Instant          getCreatedAt()       { return createdAt; }
}
