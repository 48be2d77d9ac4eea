package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.repository.JobStore;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Active while the same client has any other job that is not CANCELLED. */
@Component
public class SameClientActivityPolicy implements ClientActivityPolicy {

    private final JobStore jobs;

    public SameClientActivityPolicy(JobStore jobs) {
        this.jobs = jobs;
    }

    @Override
    public boolean hasOtherActiveWork(UUID clientId, UUID cancelledJobId) {
        return jobs.hasOtherLiveJobs(clientId, cancelledJobId);
    }
}
