package com.fieldpilot.lifecycle.statemachine;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process mutual exclusion per job id.
 *
 * Fair locks, so waiting requests are served in arrival order. An entry
 * lives only while someone holds or waits for it; the map never grows with
 * the number of jobs ever touched.
 *
 * Cross-instance serialization is the database row lock's job
 * ({@code SELECT ... FOR UPDATE} in the engine's transaction); this registry
 * keeps same-instance requests from queueing on a pooled connection.
 */
@Component
public class JobLockRegistry {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int holders;   // guarded by the map's compute
    }

    private final ConcurrentHashMap<UUID, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Acquire the lock for {@code jobId}, waiting at most {@code timeout}.
     *
     * @throws TransitionException CONCURRENT_MODIFICATION if the wait times out or is interrupted
     */
    public Lease acquire(UUID jobId, Duration timeout) {
        Entry entry = entries.compute(jobId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.holders++;
            return e;
        });

        boolean locked = false;
        try {
            locked = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!locked) {
                release(jobId);
            }
        }
        if (!locked) {
            throw new TransitionException(TransitionException.Kind.CONCURRENT_MODIFICATION, jobId,
                    "Job " + jobId + " is being modified by another request; retry");
        }
        return new Lease(jobId, entry);
    }

    /** Number of jobs with a current holder or waiter. */
    public int activeEntries() {
        return entries.size();
    }

    private void release(UUID jobId) {
        entries.computeIfPresent(jobId, (id, e) -> --e.holders == 0 ? null : e);
    }

    /** Held lock; close exactly once, on the acquiring thread. */
    public final class Lease implements AutoCloseable {

        private final UUID  jobId;
        private final Entry entry;

        private Lease(UUID jobId, Entry entry) {
            this.jobId = jobId;
            this.entry = entry;
        }

        @Override
        public void close() {
            entry.lock.unlock();
            release(jobId);
        }
    }
}
