package com.fieldpilot.lifecycle.automation;

import com.fieldpilot.lifecycle.event.EventBus;
import com.fieldpilot.lifecycle.event.LifecycleEvent;
import com.fieldpilot.lifecycle.model.AutomationRule;
import com.fieldpilot.lifecycle.model.AutomationRun;
import com.fieldpilot.lifecycle.model.RunStatus;
import com.fieldpilot.lifecycle.repository.AutomationRuleRepository;
import com.fieldpilot.lifecycle.repository.AutomationRunRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reacts to lifecycle events by firing the matching automation rules.
 *
 * For each enabled rule whose trigger equals the event type, in priority
 * order:
 * <ol>
 *   <li>evaluate the conditions against the event payload; no match means
 *       nothing is recorded</li>
 *   <li>apply the firing-rate guard (per rule, per job, sliding window);
 *       over the limit writes one RATE_LIMITED run and runs nothing</li>
 *   <li>run the actions in order, each on the worker pool with its own
 *       timeout, isolated from the others</li>
 *   <li>write exactly one AutomationRun with the per-action outcomes</li>
 * </ol>
 *
 * Nothing thrown here reaches the event bus or the original caller. Rules are
 * re-read on every event so admin edits apply to the next event.
 *
 * Delivery is at-least-once: a redelivered event produces a second run row
 * (both carry the same eventId), and the actions themselves are idempotent.
 */
@Component
public class AutomationEngine {

    private static final Logger log = LoggerFactory.getLogger(AutomationEngine.class);

    private final EventBus                 eventBus;
    private final AutomationRuleRepository ruleRepo;
    private final AutomationRunRepository  runRepo;
    private final ActionRegistry           actions;
    private final ConditionEvaluator       conditions;
    private final RuleDefinitionCodec      codec;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;
    private final Duration                 actionTimeout;
    private final ExecutorService          workers;

    public AutomationEngine(EventBus eventBus,
                            AutomationRuleRepository ruleRepo,
                            AutomationRunRepository runRepo,
                            ActionRegistry actions,
                            ConditionEvaluator conditions,
                            RuleDefinitionCodec codec,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${fieldpilot.automation.action-timeout:PT10S}") Duration actionTimeout,
                            @Value("${fieldpilot.automation.worker-threads:4}") int workerThreads) {
        this.eventBus      = eventBus;
        this.ruleRepo      = ruleRepo;
        this.runRepo       = runRepo;
        this.actions       = actions;
        this.conditions    = conditions;
        this.codec         = codec;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.actionTimeout = actionTimeout;
        AtomicInteger seq  = new AtomicInteger();
        this.workers       = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "automation-action-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    void subscribe() {
        eventBus.subscribeAll("automation-engine", this::onEvent);
    }

    /**
     * Drain the event bus first: events still queued on its lanes are
     * delivered to {@link #onEvent} while the action workers are alive.
     * Then let in-flight actions finish within one action timeout.
     */
    @PreDestroy
    void shutdown() {
        eventBus.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(actionTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Automation actions still running after {}; interrupting", actionTimeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // OnEvent
    // ------------------------------------------------------------------

    /**
     * Evaluate and fire every rule triggered by {@code event}.
     *
     * @return the runs written, in firing order (empty when no rule matched)
     */
    public List<AutomationRun> onEvent(LifecycleEvent event) {
        List<AutomationRule> rules = ruleRepo.findByTriggerEventAndEnabledTrueOrderByPriorityAscNameAsc(event.type());
        List<AutomationRun> runs = new ArrayList<>();
        for (AutomationRule rule : rules) {
            MDC.put("eventId", event.eventId().toString());
            MDC.put("jobId", event.jobId().toString());
            MDC.put("ruleId", String.valueOf(rule.getId()));
            try {
                AutomationRun run = fire(rule, event);
                if (run != null) {
                    runs.add(run);
                }
            } catch (Exception e) {
                // Storage failure while recording the run; the next rule still gets its turn.
                log.error("Rule '{}' could not be processed for event {}: {}",
                        rule.getName(), event.eventId(), e.getMessage(), e);
            } finally {
                MDC.remove("ruleId");
            }
        }
        return runs;
    }

    /** @return the recorded run, or null if the rule's conditions did not match */
    private AutomationRun fire(AutomationRule rule, LifecycleEvent event) {
        Instant firedAt = clock.instant();

        List<RuleCondition> ruleConditions;
        List<ActionSpec> specs;
        try {
            ruleConditions = codec.conditions(rule);
            specs          = codec.actions(rule);
        } catch (IllegalArgumentException e) {
            log.error("Rule '{}' has an invalid definition: {}", rule.getName(), e.getMessage());
            ActionOutcome invalid = new ActionOutcome("rule_definition", false, e.getMessage(), 0);
            return record(rule, event, RunStatus.FAILED, List.of(invalid), firedAt);
        }

        if (!conditions.matchesAll(ruleConditions, event.payload())) {
            log.debug("Rule '{}' conditions not met for {}", rule.getName(), event.type());
            return null;
        }

        Instant windowStart = firedAt.minus(Duration.ofMinutes(rule.getWindowMinutes()));
        long recent = runRepo.countByRuleIdAndJobIdAndStatusNotAndFiredAtAfter(
                rule.getId(), event.jobId(), RunStatus.RATE_LIMITED, windowStart);
        if (recent >= rule.getMaxFirings()) {
            log.warn("Rule '{}' rate limited for job {}: {} firings in the last {} min (max {})",
                    rule.getName(), event.jobId(), recent, rule.getWindowMinutes(), rule.getMaxFirings());
            return record(rule, event, RunStatus.RATE_LIMITED, List.of(), firedAt);
        }

        log.info("Rule '{}' fired on {} for job {}", rule.getName(), event.type(), event.jobId());
        List<ActionOutcome> outcomes = new ArrayList<>(specs.size());
        for (ActionSpec spec : specs) {
            outcomes.add(runAction(spec, new ActionContext(event, rule.getId(), rule.getName(), spec.config())));
        }
        return record(rule, event, statusOf(outcomes), outcomes, firedAt);
    }

    // ------------------------------------------------------------------
    // Action execution
    // ------------------------------------------------------------------

    private ActionOutcome runAction(ActionSpec spec, ActionContext ctx) {
        long started = System.nanoTime();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<ActionResult> future;
        try {
            future = workers.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return actions.execute(spec.name(), ctx);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RuntimeException e) {
            return outcome(spec, false, "could not schedule action: " + e.getMessage(), started);
        }

        try {
            ActionResult result = future.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!result.success()) {
                log.warn("Action '{}' reported failure: {}", spec.name(), result.detail());
            }
            return outcome(spec, result.success(), result.detail(), started);
        } catch (TimeoutException e) {
            future.cancel(true);
            meterRegistry.counter("fieldpilot.automation.action.calls",
                    "action", spec.name(), "status", "timeout").increment();
            log.warn("Action '{}' timed out after {}", spec.name(), actionTimeout);
            return outcome(spec, false, "timeout after " + actionTimeout.toMillis() + " ms", started);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Action '{}' failed: {}", spec.name(), cause.getMessage());
            return outcome(spec, false, cause.getMessage(), started);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return outcome(spec, false, "interrupted", started);
        }
    }

    private static ActionOutcome outcome(ActionSpec spec, boolean success, String detail, long startedNanos) {
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        return new ActionOutcome(spec.name(), success, detail, ms);
    }

    static RunStatus statusOf(List<ActionOutcome> outcomes) {
        long failed = outcomes.stream().filter(o -> !o.success()).count();
        if (failed == 0) return RunStatus.SUCCEEDED;
        if (failed == outcomes.size()) return RunStatus.FAILED;
        return RunStatus.PARTIALLY_FAILED;
    }

    private AutomationRun record(AutomationRule rule, LifecycleEvent event, RunStatus status,
                                 List<ActionOutcome> outcomes, Instant firedAt) {
        AutomationRun run = runRepo.save(new AutomationRun(
                rule.getId(), rule.getName(), event.eventId(), event.type(), event.jobId(),
                status, codec.write(outcomes), firedAt, clock.instant()));
        meterRegistry.counter("fieldpilot.automation.runs",
                "status", status.name().toLowerCase(Locale.ROOT)).increment();
        log.info("Rule '{}' run recorded: {} ({} actions)", rule.getName(), status, outcomes.size());
        return run;
    }
}
