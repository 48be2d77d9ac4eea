package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Trigger + condition + ordered actions, edited by administrators.
 *
 * Conditions and actions are stored as JSON arrays and decoded by
 * {@link com.fieldpilot.lifecycle.automation.RuleDefinitionCodec}; the engine
 * re-reads rules on every event, so edits apply from the next event on.
 *
 * DB table: automation_rules  (Flyway V2)
 */
@Entity
@Table(name = "automation_rules")
public class AutomationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    // Event type this rule listens to, e.g. "job_transitioned".
    @Column(name = "trigger_event", nullable = false)
    private String triggerEvent;

    // [{"field": "toState", "operator": "equals", "value": "completed"}]
    @Column(name = "conditions_json", nullable = false)
    private String conditionsJson = "[]";

    // [{"name": "create_draft_invoice", "config": {}}]
    @Column(name = "actions_json", nullable = false)
    private String actionsJson = "[]";

    @Column(nullable = false)
    private boolean enabled = true;

    // Firing-rate guard: at most maxFirings per job within windowMinutes.
    @Column(name = "max_firings", nullable = false)
    private int maxFirings = 5;

    @Column(name = "window_minutes", nullable = false)
    private int windowMinutes = 60;

    @Column(nullable = false)
    private int priority = 100;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected AutomationRule() {}   // required by JPA

    public AutomationRule(String name, String triggerEvent) {
        this.name         = name;
        this.triggerEvent = triggerEvent;
    }

    public UUID    getId()            { return id; }
    public String  getName()          { return name; }
    public String  getDescription()   { return description; }
    public String  getTriggerEvent()  { return triggerEvent; }
    public String  getConditionsJson(){ return conditionsJson; }
    public String  getActionsJson()   { return actionsJson; }
    public boolean isEnabled()        { return enabled; }
    public int     getMaxFirings()    { return maxFirings; }
    public int     getWindowMinutes() { return windowMinutes; }
    public int     getPriority()      { return priority; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setName(String name)                 { this.name = name; }
    public void setDescription(String description)   { this.description = description; }
    public void setTriggerEvent(String triggerEvent) { this.triggerEvent = triggerEvent; }
    public void setConditionsJson(String json)       { this.conditionsJson = json; }
    public void setActionsJson(String json)          { this.actionsJson = json; }
    public void setEnabled(boolean enabled)          { this.enabled = enabled; }
    public void setMaxFirings(int maxFirings)        { this.maxFirings = maxFirings; }
    public void setWindowMinutes(int windowMinutes)  { this.windowMinutes = windowMinutes; }
    public void setPriority(int priority)            { this.priority = priority; }
}
