package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.StateTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/** Append-only audit trail. Nothing in the service calls delete or re-saves a row. */
public interface StateTransitionRepository extends JpaRepository<StateTransition, UUID> {

    /** Full history for a job in the order it was applied. */
    List<StateTransition> findByJobIdOrderBySequenceNoAsc(UUID jobId);

    long countByJobId(UUID jobId);
}
