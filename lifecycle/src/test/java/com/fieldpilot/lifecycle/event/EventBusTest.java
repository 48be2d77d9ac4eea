package com.fieldpilot.lifecycle.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final EventBus bus = new EventBus(4, Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    void eventsOfOneJob_arriveInPublishOrder() throws Exception {
        UUID jobId = UUID.randomUUID();
        List<UUID> seen = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(LifecycleEvent.JOB_CREATED, "recorder", e -> seen.add(e.eventId()));

        List<UUID> published = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            JobCreatedEvent event = created(jobId);
            published.add(event.eventId());
            bus.publish(event);
        }

        assertThat(bus.flush(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactlyElementsOf(published);
    }

    @Test
    void failingSubscriber_doesNotStopOthers() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(LifecycleEvent.JOB_CREATED, "first", e -> seen.add("first"));
        bus.subscribe(LifecycleEvent.JOB_CREATED, "broken", e -> { throw new IllegalStateException("boom"); });
        bus.subscribeAll("last", e -> seen.add("last"));

        bus.publish(created(UUID.randomUUID()));
        bus.publish(created(UUID.randomUUID()));

        assertThat(bus.flush(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactlyInAnyOrder("first", "last", "first", "last");
    }

    @Test
    void typedSubscriber_onlyReceivesItsType() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(LifecycleEvent.JOB_SCHEDULED, "scheduled-only", e -> seen.add(e.type()));

        bus.publish(created(UUID.randomUUID()));
        bus.publish(new JobScheduledEvent(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                UUID.randomUUID(), LocalDate.of(2025, 6, 2), Instant.now()));

        assertThat(bus.flush(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactly(LifecycleEvent.JOB_SCHEDULED);
    }

    @Test
    void publish_doesNotWaitForSlowSubscriber() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        bus.subscribe(LifecycleEvent.JOB_CREATED, "slow", e -> release.await(5, TimeUnit.SECONDS));

        long started = System.nanoTime();
        bus.publish(created(UUID.randomUUID()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(1000);
        release.countDown();
        assertThat(bus.flush(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void afterShutdown_eventsAreDropped() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(LifecycleEvent.JOB_CREATED, "recorder", e -> seen.add("x"));

        bus.shutdown();
        bus.publish(created(UUID.randomUUID()));

        assertThat(bus.flush(Duration.ofSeconds(1))).isTrue();
        assertThat(seen).isEmpty();
    }

    @Test
    void shutdown_deliversQueuedEventsAndIsIdempotent() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(LifecycleEvent.JOB_CREATED, "slow", e -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            seen.add("x");
        });
        UUID jobId = UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            bus.publish(created(jobId));
        }

        bus.shutdown();
        bus.shutdown();

        assertThat(seen).hasSize(5);
    }

    private static JobCreatedEvent created(UUID jobId) {
        return new JobCreatedEvent(UUID.randomUUID(), jobId, UUID.randomUUID(), Instant.now());
    }
}
