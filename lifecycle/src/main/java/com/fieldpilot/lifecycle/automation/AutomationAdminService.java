package com.fieldpilot.lifecycle.automation;

import com.fieldpilot.lifecycle.event.LifecycleEvent;
import com.fieldpilot.lifecycle.model.AutomationRule;
import com.fieldpilot.lifecycle.model.AutomationRun;
import com.fieldpilot.lifecycle.repository.AutomationRuleRepository;
import com.fieldpilot.lifecycle.repository.AutomationRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Rule CRUD and the run log.
 *
 * Definitions are validated on write (known trigger, registered action
 * names, sane rate guard) so the engine rarely meets a broken rule.
 * Edits take effect on the next event; runs already written are never
 * touched.
 */
@Service
public class AutomationAdminService {

    private static final Logger log = LoggerFactory.getLogger(AutomationAdminService.class);

    private static final Set<String> TRIGGERS = Set.of(
            LifecycleEvent.JOB_TRANSITIONED, LifecycleEvent.JOB_SCHEDULED, LifecycleEvent.JOB_CREATED);

    private final AutomationRuleRepository ruleRepo;
    private final AutomationRunRepository  runRepo;
    private final ActionRegistry           actions;
    private final RuleDefinitionCodec      codec;

    public AutomationAdminService(AutomationRuleRepository ruleRepo,
                                  AutomationRunRepository runRepo,
                                  ActionRegistry actions,
                                  RuleDefinitionCodec codec) {
        this.ruleRepo = ruleRepo;
        this.runRepo  = runRepo;
        this.actions  = actions;
        this.codec    = codec;
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    public List<AutomationRule> rules() {
        return ruleRepo.findAllByOrderByPriorityAscNameAsc();
    }

    public Optional<AutomationRule> rule(UUID ruleId) {
        return ruleRepo.findById(ruleId);
    }

    @Transactional
    public AutomationRule create(RuleDefinition def) {
        validate(def);
        AutomationRule rule = apply(new AutomationRule(def.name().trim(), def.triggerEvent()), def);
        AutomationRule saved = ruleRepo.save(rule);
        log.info("Automation rule '{}' created ({} on {})", saved.getName(), saved.getId(), saved.getTriggerEvent());
        return saved;
    }

    @Transactional
    public AutomationRule update(UUID ruleId, RuleDefinition def) {
        validate(def);
        AutomationRule rule = require(ruleId);
        rule.setName(def.name().trim());
        rule.setTriggerEvent(def.triggerEvent());
        AutomationRule saved = ruleRepo.save(apply(rule, def));
        log.info("Automation rule '{}' ({}) updated", saved.getName(), saved.getId());
        return saved;
    }

    @Transactional
    public AutomationRule setEnabled(UUID ruleId, boolean enabled) {
        AutomationRule rule = require(ruleId);
        rule.setEnabled(enabled);
        log.info("Automation rule '{}' ({}) {}", rule.getName(), ruleId, enabled ? "enabled" : "disabled");
        return ruleRepo.save(rule);
    }

    /** Deletes the rule; its past runs stay in the log. */
    @Transactional
    public void delete(UUID ruleId) {
        AutomationRule rule = require(ruleId);
        ruleRepo.delete(rule);
        log.info("Automation rule '{}' ({}) deleted", rule.getName(), ruleId);
    }

    public List<RuleCondition> conditionsOf(AutomationRule rule) {
        return codec.conditions(rule);
    }

    public List<ActionSpec> actionsOf(AutomationRule rule) {
        return codec.actions(rule);
    }

    // ------------------------------------------------------------------
    // Run log
    // ------------------------------------------------------------------

    /** Runs for a job or an event (oldest first), or the latest 100 when neither is given. */
    public List<AutomationRun> runs(UUID jobId, UUID eventId) {
        if (eventId != null) {
            List<AutomationRun> byEvent = runRepo.findByEventIdOrderByFiredAtAsc(eventId);
            return jobId == null ? byEvent : byEvent.stream().filter(r -> jobId.equals(r.getJobId())).toList();
        }
        if (jobId != null) {
            return runRepo.findByJobIdOrderByFiredAtAsc(jobId);
        }
        return runRepo.findTop100ByOrderByFiredAtDesc();
    }

    public List<ActionOutcome> outcomesOf(AutomationRun run) {
        return codec.outcomes(run.getActionResults());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AutomationRule require(UUID ruleId) {
        return ruleRepo.findById(ruleId).orElseThrow(() ->
                new NoSuchElementException("Automation rule " + ruleId + " not found"));
    }

    private AutomationRule apply(AutomationRule rule, RuleDefinition def) {
        rule.setDescription(def.description());
        rule.setConditionsJson(codec.write(def.conditions()));
        rule.setActionsJson(codec.write(def.actions()));
        if (def.enabled() != null)       rule.setEnabled(def.enabled());
        if (def.maxFirings() != null)    rule.setMaxFirings(def.maxFirings());
        if (def.windowMinutes() != null) rule.setWindowMinutes(def.windowMinutes());
        if (def.priority() != null)      rule.setPriority(def.priority());
        return rule;
    }

    private void validate(RuleDefinition def) {
        if (def.name() == null || def.name().isBlank()) {
            throw new IllegalArgumentException("Rule name is required");
        }
        if (!TRIGGERS.contains(def.triggerEvent())) {
            throw new IllegalArgumentException("Unknown trigger event '" + def.triggerEvent() + "', expected one of " + TRIGGERS);
        }
        if (def.actions().isEmpty()) {
            throw new IllegalArgumentException("A rule needs at least one action");
        }
        for (ActionSpec spec : def.actions()) {
            if (!actions.contains(spec.name())) {
                throw new IllegalArgumentException("Unknown action '" + spec.name() + "', registered: " + actions.actionNames());
            }
        }
        for (RuleCondition c : def.conditions()) {
            if (c.field() == null || c.field().isBlank() || c.operator() == null || c.operator().isBlank()) {
                throw new IllegalArgumentException("Every condition needs a field and an operator");
            }
        }
        if (def.maxFirings() != null && def.maxFirings() < 1) {
            throw new IllegalArgumentException("maxFirings must be >= 1");
        }
        if (def.windowMinutes() != null && def.windowMinutes() < 1) {
            throw new IllegalArgumentException("windowMinutes must be >= 1");
        }
    }
}
