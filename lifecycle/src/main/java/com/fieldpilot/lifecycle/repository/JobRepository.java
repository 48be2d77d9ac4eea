package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the jobs table.
 *
 * Callers outside the state machine must treat Job.state as read-only;
 * {@link JpaJobStore} is the only writer of transitions.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * SELECT ... FOR UPDATE on one job row.
     *
     * Must run inside a transaction. The lock timeout hint bounds the wait
     * so a stuck transaction surfaces as a lock failure instead of hanging
     * the request. Keep the hint in line with fieldpilot.lifecycle.lock-timeout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "2000"))
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Jobs for one client not in the given state (used by the category downgrade guard). */
    long countByClientIdAndIdNotAndStateNot(UUID clientId, UUID excludedJobId, JobState state);
}
