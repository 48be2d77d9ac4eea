package com.fieldpilot.lifecycle.recurrence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly trigger for the recurrence generator.
 *
 * Overlapping runs (several instances, or a manual generate during the
 * nightly one) are harmless; the generator is idempotent per
 * (series, occurrence date).
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "fieldpilot.recurrence.enabled", havingValue = "true", matchIfMissing = true)
public class RecurrenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceScheduler.class);

    private final RecurrenceGenerator generator;

    public RecurrenceScheduler(RecurrenceGenerator generator) {
        this.generator = generator;
    }

    @Scheduled(cron = "${fieldpilot.recurrence.cron:0 15 2 * * *}")
    public void tick() {
        try {
            generator.runOnce();
        } catch (Exception e) {
            log.error("Scheduled recurrence run failed: {}", e.getMessage(), e);
        }
    }
}
