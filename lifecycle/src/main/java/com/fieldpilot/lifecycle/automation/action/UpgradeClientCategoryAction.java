package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.automation.gateway.ClientCategoryGateway;
import com.fieldpilot.lifecycle.model.ClientCategory;
import com.fieldpilot.lifecycle.repository.JobStore;
import org.springframework.stereotype.Component;

import java.util.UUID;

/** Marks the job's client as an active customer. */
@Component
public class UpgradeClientCategoryAction implements AutomationAction {

    private final ClientCategoryGateway clients;
    private final JobStore              jobs;

    public UpgradeClientCategoryAction(ClientCategoryGateway clients, JobStore jobs) {
        this.clients = clients;
        this.jobs    = jobs;
    }

    @Override
    public String name() {
        return "upgrade_client_category";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        UUID clientId = ClientOfJob.resolve(ctx, jobs);
        boolean changed = clients.setCategory(clientId, ClientCategory.ACTIVE);
        return ActionResult.ok(changed
                ? "client " + clientId + " upgraded to active"
                : "client " + clientId + " already active");
    }
}
