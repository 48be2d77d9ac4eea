package com.fieldpilot.lifecycle.recurrence;

import com.fieldpilot.lifecycle.event.EventBus;
import com.fieldpilot.lifecycle.event.JobScheduledEvent;
import com.fieldpilot.lifecycle.model.InstanceStatus;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.RecurringInstance;
import com.fieldpilot.lifecycle.model.RecurringSeries;
import com.fieldpilot.lifecycle.repository.JobStore;
import com.fieldpilot.lifecycle.repository.RecurringInstanceRepository;
import com.fieldpilot.lifecycle.repository.RecurringSeriesRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Expands recurring series into dated instances and turns near-term
 * instances into Draft jobs.
 *
 * Per series and run:
 * <ol>
 *   <li>project occurrences from today up to the look-ahead horizon and
 *       insert the missing ones as PENDING instances (bounded per run)</li>
 *   <li>for PENDING instances dated within the materialization window,
 *       create a DRAFT job and mark the instance MATERIALIZED in one
 *       transaction, then publish {@code job_scheduled}</li>
 * </ol>
 * Safe to re-run any number of times on the same day: the unique
 * (series, date) key turns a repeated insert into a skip, and an instance is
 * materialized only from PENDING under a row lock.
 *
 * Past-dated PENDING instances are left alone; the office skips or
 * reschedules missed visits by hand.
 */
@Service
public class RecurrenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceGenerator.class);

    private final RecurringSeriesRepository   seriesRepo;
    private final RecurringInstanceRepository instanceRepo;
    private final JobStore                    jobs;
    private final EventBus                    eventBus;
    private final TransactionOperations       tx;
    private final MeterRegistry               meterRegistry;
    private final Clock                       clock;
    private final int                         horizonDays;
    private final int                         maxInstancesPerRun;
    private final int                         materializeDays;

    public RecurrenceGenerator(RecurringSeriesRepository seriesRepo,
                               RecurringInstanceRepository instanceRepo,
                               JobStore jobs,
                               EventBus eventBus,
                               TransactionOperations tx,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               @Value("${fieldpilot.recurrence.horizon-days:60}") int horizonDays,
                               @Value("${fieldpilot.recurrence.max-instances-per-run:180}") int maxInstancesPerRun,
                               @Value("${fieldpilot.recurrence.materialize-days:7}") int materializeDays) {
        this.seriesRepo         = seriesRepo;
        this.instanceRepo       = instanceRepo;
        this.jobs               = jobs;
        this.eventBus           = eventBus;
        this.tx                 = tx;
        this.meterRegistry      = meterRegistry;
        this.clock              = clock;
        this.horizonDays        = horizonDays;
        this.maxInstancesPerRun = maxInstancesPerRun;
        this.materializeDays    = materializeDays;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public GenerationSummary runOnce() {
        return runOnce(LocalDate.now(clock));
    }

    /** Process every active series. One broken series does not stop the others. */
    public GenerationSummary runOnce(LocalDate today) {
        GenerationSummary total = GenerationSummary.empty();
        for (RecurringSeries series : seriesRepo.findByActiveTrue()) {
            try {
                total = total.plus(generate(series, today));
            } catch (RuntimeException e) {
                log.error("Recurrence generation failed for series {} ('{}'): {}",
                        series.getId(), series.getName(), e.getMessage(), e);
                total = total.plus(new GenerationSummary(1, 0, 0, 0, 1));
            }
        }
        log.info("Recurrence run for {}: {}", today, total);
        return total;
    }

    public GenerationSummary generate(RecurringSeries series, LocalDate today) {
        if (!series.isActive()) {
            log.debug("Series {} is inactive; skipping", series.getId());
            return new GenerationSummary(1, 0, 0, 0, 0);
        }
        Projection projected = project(series, today);
        int materialized = materialize(series, today);
        return new GenerationSummary(1, projected.created(), projected.duplicates(), materialized, 0);
    }

    // ------------------------------------------------------------------
    // Step 1: instances
    // ------------------------------------------------------------------

    private record Projection(int created, int duplicates) {}

    private Projection project(RecurringSeries series, LocalDate today) {
        LocalDate horizon = today.plusDays(horizonDays);
        Set<LocalDate> existing = instanceRepo.findBySeriesIdAndOccurrenceDateBetween(series.getId(), today, horizon)
                .stream()
                .map(RecurringInstance::getOccurrenceDate)
                .collect(Collectors.toSet());

        List<LocalDate> wanted = RecurrenceCalculator.occurrences(series, today, horizon, maxInstancesPerRun + existing.size());
        int created = 0;
        int duplicates = 0;
        for (LocalDate date : wanted) {
            if (created >= maxInstancesPerRun) {
                log.warn("Series {} hit the per-run cap of {} new instances", series.getId(), maxInstancesPerRun);
                break;
            }
            if (existing.contains(date)) {
                continue;
            }
            try {
                instanceRepo.saveAndFlush(new RecurringInstance(series.getId(), date));
                created++;
            } catch (DataIntegrityViolationException e) {
                // Another run inserted the same (series, date) first.
                duplicates++;
                log.debug("Instance {} / {} already exists; skipped", series.getId(), date);
            }
        }
        if (created > 0) {
            meterRegistry.counter("fieldpilot.recurrence.instances.created").increment(created);
            log.info("Series {} ('{}'): {} new instances up to {}", series.getId(), series.getName(), created, horizon);
        }
        return new Projection(created, duplicates);
    }

    // ------------------------------------------------------------------
    // Step 2: jobs
    // ------------------------------------------------------------------

    private int materialize(RecurringSeries series, LocalDate today) {
        List<RecurringInstance> due = instanceRepo.findBySeriesIdAndStatusAndOccurrenceDateBetweenOrderByOccurrenceDateAsc(
                series.getId(), InstanceStatus.PENDING, today, today.plusDays(materializeDays));
        int count = 0;
        for (RecurringInstance candidate : due) {
            JobScheduledEvent event = tx.execute(status -> materializeOne(series, candidate.getId()));
            if (event != null) {
                eventBus.publish(event);
                count++;
            }
        }
        if (count > 0) {
            meterRegistry.counter("fieldpilot.recurrence.jobs.materialized").increment(count);
        }
        return count;
    }

    /** Runs in a transaction. Returns null if someone else got to the instance first. */
    private JobScheduledEvent materializeOne(RecurringSeries series, UUID instanceId) {
        RecurringInstance instance = instanceRepo.findByIdForUpdate(instanceId).orElse(null);
        if (instance == null || instance.getStatus() != InstanceStatus.PENDING) {
            return null;
        }

        Job job = new Job(series.getClientId(), series.getName() + " (" + instance.getOccurrenceDate() + ")");
        job.setPropertyId(series.getPropertyId());
        job.setSeriesId(series.getId());
        job.setAssignedCrew(series.getDefaultCrew());
        Instant start = instance.getOccurrenceDate().atTime(series.getVisitStartTime()).atZone(clock.getZone()).toInstant();
        Instant end = series.getEstimatedDurationHours() == null
                ? null
                : start.plus(Duration.ofMinutes(Math.round(series.getEstimatedDurationHours() * 60)));
        job.setSchedulingWindow(start, end);
        job = jobs.save(job);

        instance.markMaterialized(job.getId());
        instanceRepo.save(instance);
        log.info("Series {} visit on {} materialized as job {}", series.getId(), instance.getOccurrenceDate(), job.getId());

        return new JobScheduledEvent(UUID.randomUUID(), job.getId(), series.getClientId(), series.getId(),
                instance.getOccurrenceDate(), clock.instant());
    }
}
