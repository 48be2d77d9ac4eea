package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.automation.gateway.ClientCategoryGateway;
import com.fieldpilot.lifecycle.model.ClientCategory;
import com.fieldpilot.lifecycle.repository.JobStore;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Moves the client back to potential after a cancellation, unless the
 * {@link ClientActivityPolicy} says it still has other live work.
 */
@Component
public class DowngradeClientCategoryAction implements AutomationAction {

    private final ClientCategoryGateway clients;
    private final ClientActivityPolicy  activity;
    private final JobStore              jobs;

    public DowngradeClientCategoryAction(ClientCategoryGateway clients,
                                         ClientActivityPolicy activity,
                                         JobStore jobs) {
        this.clients  = clients;
        this.activity = activity;
        this.jobs     = jobs;
    }

    @Override
    public String name() {
        return "downgrade_client_category";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        UUID clientId = ClientOfJob.resolve(ctx, jobs);
        if (activity.hasOtherActiveWork(clientId, ctx.jobId())) {
            return ActionResult.ok("client " + clientId + " has other active jobs; category kept");
        }
        boolean changed = clients.setCategory(clientId, ClientCategory.POTENTIAL);
        return ActionResult.ok(changed
                ? "client " + clientId + " downgraded to potential"
                : "client " + clientId + " already potential");
    }
}
