package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.AutomationRun;
import com.fieldpilot.lifecycle.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AutomationRunRepository extends JpaRepository<AutomationRun, UUID> {

    /**
     * Firings of one rule for one job since {@code since}, excluding the given
     * status. The automation engine passes RATE_LIMITED so that skipped
     * firings do not extend the lockout.
     */
    long countByRuleIdAndJobIdAndStatusNotAndFiredAtAfter(UUID ruleId, UUID jobId,
                                                          RunStatus excluded, Instant since);

    List<AutomationRun> findByJobIdOrderByFiredAtAsc(UUID jobId);

    List<AutomationRun> findByEventIdOrderByFiredAtAsc(UUID eventId);

    List<AutomationRun> findTop100ByOrderByFiredAtDesc();
}
