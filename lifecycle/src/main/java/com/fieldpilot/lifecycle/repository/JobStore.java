package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.StateTransition;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary of the state machine engine.
 *
 * Injected explicitly instead of reading jobs from a shared in-memory
 * cache. The JPA implementation is {@link JpaJobStore}; tests use an
 * in-memory one.
 */
public interface JobStore {

    Optional<Job> findById(UUID jobId);

    /**
     * Load a job and take the row-level write lock. Only valid inside the
     * engine's transaction; the lock is held until that transaction ends.
     */
    Optional<Job> lockById(UUID jobId);

    Job save(Job job);

    StateTransition appendTransition(StateTransition transition);

    /** Audit history of one job, ordered by sequence number. */
    List<StateTransition> history(UUID jobId);

    /** True when the client has a job other than {@code excludedJobId} that is not CANCELLED. */
    boolean hasOtherLiveJobs(UUID clientId, UUID excludedJobId);
}
