package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Data preconditions on the job itself, independent of who asks.
 *
 * A job cannot be put on the calendar, or worked on, without a time
 * window and at least one crew member.
 */
final class JobReadiness {

    private static final Set<JobState> NEEDS_SCHEDULE = EnumSet.of(
            JobState.SCHEDULED, JobState.EN_ROUTE, JobState.ON_SITE, JobState.IN_PROGRESS);

    private JobReadiness() {}

    /** Human-readable reasons the job may not enter {@code target}; empty when ready. */
    static List<String> blockers(Job job, JobState target) {
        List<String> blockers = new ArrayList<>();
        if (NEEDS_SCHEDULE.contains(target)) {
            if (job.getScheduledStart() == null) {
                blockers.add("scheduled start is required to move a job to " + target.displayName());
            }
            if (job.getAssignedCrew().isEmpty()) {
                blockers.add("at least one crew member must be assigned to move a job to " + target.displayName());
            }
        }
        return blockers;
    }
}
