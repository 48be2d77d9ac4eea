package com.fieldpilot.lifecycle.service;

import com.fieldpilot.lifecycle.event.EventBus;
import com.fieldpilot.lifecycle.event.JobCreatedEvent;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.repository.JobStore;
import com.fieldpilot.lifecycle.statemachine.TransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Opening jobs and editing their scheduling data.
 *
 * Neither operation touches {@code state}: new jobs start in DRAFT and every
 * later state change goes through the state machine engine.
 */
@Service
public class JobIntakeService {

    private static final Logger log = LoggerFactory.getLogger(JobIntakeService.class);

    private final JobStore              jobs;
    private final EventBus              eventBus;
    private final TransactionOperations tx;
    private final Clock                 clock;

    public JobIntakeService(JobStore jobs, EventBus eventBus, TransactionOperations tx, Clock clock) {
        this.jobs     = jobs;
        this.eventBus = eventBus;
        this.tx       = tx;
        this.clock    = clock;
    }

    /** Create a DRAFT job and publish {@code job_created} once it is stored. */
    public Job openJob(NewJob request) {
        validateWindow(request.scheduledStart(), request.scheduledEnd());

        Job job = new Job(request.clientId(), request.title().trim());
        job.setPropertyId(request.propertyId());
        job.setSchedulingWindow(request.scheduledStart(), request.scheduledEnd());
        job.setAssignedCrew(request.assignedCrew());
        job.setCostPayload(request.costPayload());
        Job saved = jobs.save(job);

        log.info("Job {} opened for client {} ('{}')", saved.getId(), saved.getClientId(), saved.getTitle());
        eventBus.publish(new JobCreatedEvent(UUID.randomUUID(), saved.getId(), saved.getClientId(), clock.instant()));
        return saved;
    }

    public Optional<Job> findById(UUID jobId) {
        return jobs.findById(jobId);
    }

    /**
     * Set the visit window and crew. Taken under the job's row lock so a
     * concurrent transition is not overwritten by a stale copy.
     *
     * @throws TransitionException JOB_NOT_FOUND, or INVALID_TRANSITION for a job in a terminal state
     */
    public Job updateSchedule(UUID jobId, Instant start, Instant end, List<String> crew) {
        validateWindow(start, end);
        Job updated = tx.execute(status -> {
            Job job = jobs.lockById(jobId).orElseThrow(() ->
                    new TransitionException(TransitionException.Kind.JOB_NOT_FOUND, jobId, "Job " + jobId + " not found"));
            if (job.getState().isTerminal()) {
                throw new TransitionException(TransitionException.Kind.INVALID_TRANSITION, jobId,
                        "Job is " + job.getState().displayName() + "; its schedule can no longer change");
            }
            job.setSchedulingWindow(start, end);
            if (crew != null) {
                job.setAssignedCrew(crew);
            }
            return jobs.save(job);
        });
        log.info("Job {} rescheduled: start={} end={} crew={}", jobId, start, end, updated.getAssignedCrew());
        return updated;
    }

    private static void validateWindow(Instant start, Instant end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("scheduledEnd must not be before scheduledStart");
        }
    }
}
