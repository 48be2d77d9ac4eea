package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionException;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.repository.JobStore;

import java.util.UUID;

/** Client id from the event payload, falling back to the job row. */
final class ClientOfJob {

    private ClientOfJob() {}

    static UUID resolve(ActionContext ctx, JobStore jobs) {
        String fromPayload = ctx.payloadString("clientId");
        if (fromPayload != null) {
            return UUID.fromString(fromPayload);
        }
        return jobs.findById(ctx.jobId())
                .map(Job::getClientId)
                .orElseThrow(() -> new ActionException(ActionException.Kind.NOT_FOUND,
                        "Job " + ctx.jobId() + " not found"));
    }
}
