package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.event.EventBus;
import com.fieldpilot.lifecycle.event.JobTransitionedEvent;
import com.fieldpilot.lifecycle.model.Actor;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.StateTransition;
import com.fieldpilot.lifecycle.model.TransitionSource;
import com.fieldpilot.lifecycle.repository.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * The only component allowed to change a job's state.
 *
 * Every request goes through the same sequence:
 * <ol>
 *   <li>take the in-process per-job lock (bounded wait)</li>
 *   <li>in one transaction: re-read the job with a row lock, validate the
 *       edge against the {@link TransitionTable}, apply the new state and
 *       insert the audit row</li>
 *   <li>release the lock, then publish {@code job_transitioned}</li>
 * </ol>
 * A rejected request leaves the job and its history untouched and publishes
 * nothing. Subscribers only ever see committed transitions.
 */
@Service
public class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    private final JobStore              store;
    private final TransitionTable       table;
    private final EventBus              eventBus;
    private final JobLockRegistry       locks;
    private final TransactionOperations tx;
    private final MeterRegistry         meterRegistry;
    private final Clock                 clock;
    private final Duration              lockTimeout;

    public JobStateMachine(JobStore store,
                           TransitionTable table,
                           EventBus eventBus,
                           JobLockRegistry locks,
                           TransactionOperations tx,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           @Value("${fieldpilot.lifecycle.lock-timeout:PT2S}") Duration lockTimeout) {
        this.store         = store;
        this.table         = table;
        this.eventBus      = eventBus;
        this.locks         = locks;
        this.tx            = tx;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.lockTimeout   = lockTimeout;
    }

    // ------------------------------------------------------------------
    // RequestTransition
    // ------------------------------------------------------------------

    public TransitionResult requestTransition(UUID jobId, JobState target, Actor actor, String reason) {
        return requestTransition(jobId, target, actor, reason, TransitionSource.MANUAL);
    }

    /**
     * Validate and apply one transition.
     *
     * @throws TransitionException with the kind describing why the request was rejected
     */
    public TransitionResult requestTransition(UUID jobId,
                                              JobState target,
                                              Actor actor,
                                              String reason,
                                              TransitionSource source) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "applied";
        try {
            JobTransitionedEvent event;
            try (JobLockRegistry.Lease lease = locks.acquire(jobId, lockTimeout)) {
                event = tx.execute(status -> apply(jobId, target, actor, normalize(reason), source));
            } catch (ConcurrencyFailureException e) {
                throw new TransitionException(TransitionException.Kind.CONCURRENT_MODIFICATION, jobId,
                        "Job " + jobId + " is locked by another writer; retry", List.of(), e);
            }

            log.info("Job {} {} -> {} by {} ({}, source={})",
                    jobId, event.fromState(), event.toState(), actor.id(), actor.role(), source);
            eventBus.publish(event);
            return new TransitionResult(jobId, event.fromState(), event.toState(),
                    event.transitionId(), event.occurredAt());
        } catch (TransitionException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            log.info("Transition of job {} to {} rejected for {}: {}", jobId, target, actor.id(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Transition of job {} to {} failed: {}", jobId, target, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("fieldpilot.transition.duration"));
            meterRegistry.counter("fieldpilot.transition.requests", "outcome", outcome).increment();
        }
    }

    /** Runs inside the transaction; any exception rolls back both writes. */
    private JobTransitionedEvent apply(UUID jobId, JobState target, Actor actor,
                                       String reason, TransitionSource source) {
        Job job = store.lockById(jobId).orElseThrow(() -> notFound(jobId));
        JobState from = job.getState();

        if (from.isTerminal()) {
            throw new TransitionException(TransitionException.Kind.INVALID_TRANSITION, jobId,
                    "Job is " + from.displayName() + ", a terminal state; no further transitions");
        }
        TransitionRule rule = table.rule(from, target).orElseThrow(() ->
                new TransitionException(TransitionException.Kind.INVALID_TRANSITION, jobId,
                        "Cannot move a job from " + from.displayName() + " to " + target.displayName()));

        if (!rule.permits(actor.role())) {
            throw new TransitionException(TransitionException.Kind.FORBIDDEN, jobId,
                    "Role " + actor.role() + " may not move a job from "
                            + from.displayName() + " to " + target.displayName());
        }

        List<String> blockers = new ArrayList<>();
        if (rule.reasonRequired() && reason == null) {
            blockers.add("a reason is required to move a job to " + target.displayName());
        }
        blockers.addAll(JobReadiness.blockers(job, target));
        if (!blockers.isEmpty()) {
            throw new TransitionException(TransitionException.Kind.PRECONDITION_FAILED, jobId,
                    "Job is not ready for " + target.displayName(), blockers);
        }

        StateTransition audit = job.transitionTo(target, actor, reason, source, table.version(), clock.instant());
        store.save(job);
        StateTransition saved = store.appendTransition(audit);
        return JobTransitionedEvent.of(job, saved, rule.hooks());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Target states this actor could move the job to right now: edges out
     * of the current state whose role check and readiness guard both pass.
     * Reason-required edges are included; the reason is supplied with the
     * request.
     */
    public List<JobState> allowedTransitions(UUID jobId, Actor actor) {
        Job job = store.findById(jobId).orElseThrow(() -> notFound(jobId));
        return table.rulesFrom(job.getState()).stream()
                .filter(rule -> rule.permits(actor.role()))
                .filter(rule -> JobReadiness.blockers(job, rule.to()).isEmpty())
                .map(TransitionRule::to)
                .toList();
    }

    /** Audit history in the order it was applied. */
    public List<StateTransition> history(UUID jobId) {
        if (store.findById(jobId).isEmpty()) {
            throw notFound(jobId);
        }
        return store.history(jobId);
    }

    public String tableVersion() {
        return table.version();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TransitionException notFound(UUID jobId) {
        return new TransitionException(TransitionException.Kind.JOB_NOT_FOUND, jobId, "Job " + jobId + " not found");
    }

    private static String normalize(String reason) {
        return reason == null || reason.isBlank() ? null : reason.trim();
    }
}
