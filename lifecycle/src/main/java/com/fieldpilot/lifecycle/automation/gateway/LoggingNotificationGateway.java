package com.fieldpilot.lifecycle.automation.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default gateway until a messaging module is wired in: records what would
 * have been sent.
 */
@Component
public class LoggingNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationGateway.class);

    @Override
    public void send(Notification n) {
        log.info("Notification [{} -> {}] template='{}' job={} data={}",
                n.channel(), n.audience(), n.template(), n.jobId(), n.data());
    }
}
