package com.fieldpilot.lifecycle.automation.gateway;

/** Boundary to the messaging module (email/SMS delivery lives outside this service). */
public interface NotificationGateway {

    void send(Notification notification);
}
