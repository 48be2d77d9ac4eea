package com.fieldpilot.lifecycle.event;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * In-process publish/subscribe for lifecycle events.
 *
 * Delivery runs on a fixed set of single-threaded lanes. The lane is chosen
 * from the event's job id, so all events of one job reach every subscriber
 * in publish order, while different jobs proceed in parallel.
 *
 * {@link #publish} never blocks on subscribers and never sees their
 * exceptions: a failing subscriber is logged and the next one still runs.
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Registration(String name, EventSubscriber subscriber) {}

    private final List<ExecutorService> lanes;
    private final Map<String, List<Registration>> byType = new ConcurrentHashMap<>();
    private final List<Registration> everyEvent = new CopyOnWriteArrayList<>();
    private final Duration drainTimeout;

    private volatile boolean closed;

    public EventBus(@Value("${fieldpilot.events.lanes:4}") int laneCount,
                    @Value("${fieldpilot.events.drain-timeout:PT10S}") Duration drainTimeout) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("fieldpilot.events.lanes must be >= 1, was " + laneCount);
        }
        this.drainTimeout = drainTimeout;
        List<ExecutorService> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            created.add(Executors.newSingleThreadExecutor(laneThreads(i)));
        }
        this.lanes = List.copyOf(created);
    }

    // ------------------------------------------------------------------
    // Subscription
    // ------------------------------------------------------------------

    public void subscribe(String eventType, String name, EventSubscriber subscriber) {
        byType.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
              .add(new Registration(name, subscriber));
        log.info("Subscriber '{}' registered for {}", name, eventType);
    }

    public void subscribeAll(String name, EventSubscriber subscriber) {
        everyEvent.add(new Registration(name, subscriber));
        log.info("Subscriber '{}' registered for all events", name);
    }

    // ------------------------------------------------------------------
    // Publishing
    // ------------------------------------------------------------------

    /**
     * Queue the event for delivery and return immediately. Subscribers
     * registered after this call do not receive it.
     */
    public void publish(LifecycleEvent event) {
        List<Registration> targets = new ArrayList<>(byType.getOrDefault(event.type(), List.of()));
        targets.addAll(everyEvent);
        if (targets.isEmpty()) {
            log.debug("No subscribers for {} {}", event.type(), event.eventId());
            return;
        }
        if (closed) {
            log.warn("Event bus is shut down; dropping {} {} for job {}", event.type(), event.eventId(), event.jobId());
            return;
        }
        try {
            laneFor(event).execute(() -> deliver(event, targets));
        } catch (RejectedExecutionException e) {
            log.warn("Event bus is shut down; dropping {} {} for job {}", event.type(), event.eventId(), event.jobId());
        }
    }

    private void deliver(LifecycleEvent event, List<Registration> targets) {
        MDC.put("eventId", event.eventId().toString());
        MDC.put("jobId", event.jobId().toString());
        try {
            for (Registration r : targets) {
                try {
                    r.subscriber().onEvent(event);
                } catch (Exception e) {
                    log.error("Subscriber '{}' failed on {} {}: {}",
                            r.name(), event.type(), event.eventId(), e.getMessage(), e);
                }
            }
        } finally {
            MDC.clear();
        }
    }

    private ExecutorService laneFor(LifecycleEvent event) {
        return lanes.get(Math.floorMod(event.jobId().hashCode(), lanes.size()));
    }

    // ------------------------------------------------------------------
    // Draining
    // ------------------------------------------------------------------

    /**
     * Wait until every event published before this call has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        CountDownLatch barrier = new CountDownLatch(lanes.size());
        for (ExecutorService lane : lanes) {
            try {
                lane.execute(barrier::countDown);
            } catch (RejectedExecutionException e) {
                barrier.countDown();
            }
        }
        return barrier.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop accepting events and deliver what is already queued. Idempotent:
     * the automation engine calls it before closing its own workers.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        lanes.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        for (ExecutorService lane : lanes) {
            try {
                long remaining = deadline - System.nanoTime();
                if (!lane.awaitTermination(Math.max(remaining, 0), TimeUnit.NANOSECONDS)) {
                    log.warn("Event lane did not drain within {}; dropping queued deliveries", drainTimeout);
                    lane.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lane.shutdownNow();
            }
        }
    }

    private static ThreadFactory laneThreads(int index) {
        return r -> {
            Thread t = new Thread(r, "event-lane-" + index);
            t.setDaemon(true);
            return t;
        };
    }
}
