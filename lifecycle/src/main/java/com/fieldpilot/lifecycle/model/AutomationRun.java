package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per matched rule firing, including rate-limited ones.
 *
 * Tagged with the triggering event id so a redelivered event shows up as a
 * second run for the same event. Also the source of truth for the
 * firing-rate guard.
 *
 * DB table: automation_runs  (Flyway V2)
 */
@Entity
@Table(name = "automation_runs")
public class AutomationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "rule_id", nullable = false, updatable = false)
    private UUID ruleId;

    @Column(name = "rule_name", nullable = false, updatable = false)
    private String ruleName;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private RunStatus status;

    // JSON array of ActionOutcome
    @Column(name = "action_results", updatable = false)
    private String actionResults;

    @Column(name = "fired_at", nullable = false, updatable = false)
    private Instant firedAt;

    @Column(name = "completed_at", updatable = false)
    private Instant completedAt;

    protected AutomationRun() {}   // required by JPA

    public AutomationRun(UUID ruleId, String ruleName, UUID eventId, String eventType, UUID jobId,
                         RunStatus status, String actionResults, Instant firedAt, Instant completedAt) {
        this.ruleId        = ruleId;
        this.ruleName      = ruleName;
        this.eventId       = eventId;
        this.eventType     = eventType;
        this.jobId         = jobId;
        this.status        = status;
        this.actionResults = actionResults;
        this.firedAt       = firedAt;
        this.completedAt   = completedAt;
    }

    public UUID      getId()            { return id; }
    public UUID      getRuleId()        { return ruleId; }
    public String    getRuleName()      { return ruleName; }
    public UUID      getEventId()       { return eventId; }
    public String    getEventType()     { return eventType; }
    public UUID      getJobId()         { return jobId; }
    public RunStatus getStatus()        { return status; }
    public String    getActionResults() { return actionResults; }
    public Instant   getFiredAt()       { return firedAt; }
    public Instant   getCompletedAt()   { return completedAt; }
}
