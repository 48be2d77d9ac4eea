package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.automation.gateway.Notification;
import com.fieldpilot.lifecycle.automation.gateway.NotificationGateway;
import org.springframework.stereotype.Component;

/** Hands a templated message to the {@link NotificationGateway}; config: channel, audience, template. */
@Component
public class SendNotificationAction implements AutomationAction {

    private final NotificationGateway gateway;

    public SendNotificationAction(NotificationGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public String name() {
        return "send_notification";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        String template = ctx.requireConfig("template");
        String channel  = ctx.configString("channel", "email");
        String audience = ctx.configString("audience", "client");
        gateway.send(new Notification(ctx.jobId(), channel, audience, template, ctx.event().payload()));
        return ActionResult.ok(channel + " '" + template + "' sent to " + audience);
    }
}
