package com.fieldpilot.lifecycle.service;

import com.fieldpilot.lifecycle.model.InstanceStatus;
import com.fieldpilot.lifecycle.model.RecurringInstance;
import com.fieldpilot.lifecycle.model.RecurringSeries;
import com.fieldpilot.lifecycle.repository.RecurringInstanceRepository;
import com.fieldpilot.lifecycle.repository.RecurringSeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/** Series definitions and manual handling of individual visits. */
@Service
public class RecurringSeriesService {

    private static final Logger log = LoggerFactory.getLogger(RecurringSeriesService.class);

    private final RecurringSeriesRepository   seriesRepo;
    private final RecurringInstanceRepository instanceRepo;

    public RecurringSeriesService(RecurringSeriesRepository seriesRepo, RecurringInstanceRepository instanceRepo) {
        this.seriesRepo   = seriesRepo;
        this.instanceRepo = instanceRepo;
    }

    @Transactional
    public RecurringSeries create(NewSeries req) {
        if (req.clientId() == null || req.frequency() == null || req.startDate() == null) {
            throw new IllegalArgumentException("clientId, frequency and startDate are required");
        }
        if (req.name() == null || req.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (req.dayOfMonth() != null && (req.dayOfMonth() < 1 || req.dayOfMonth() > 31)) {
            throw new IllegalArgumentException("dayOfMonth must be between 1 and 31");
        }
        if (req.endDate() != null && req.endDate().isBefore(req.startDate())) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }

        RecurringSeries series = new RecurringSeries(req.clientId(), req.name().trim(), req.frequency(),
                req.intervalCount() == null ? 1 : req.intervalCount(), req.startDate());
        series.setPropertyId(req.propertyId());
        series.setDayOfWeek(req.dayOfWeek());
        series.setDayOfMonth(req.dayOfMonth());
        series.setEndDate(req.endDate());
        if (req.defaultCrew() != null) series.setDefaultCrew(req.defaultCrew());
        if (req.visitStartTime() != null) series.setVisitStartTime(req.visitStartTime());
        series.setEstimatedDurationHours(req.estimatedDurationHours());
        series.setNotes(req.notes());

        RecurringSeries saved = seriesRepo.save(series);
        log.info("Recurring series {} created: {} every {} from {}",
                saved.getId(), saved.getFrequency(), saved.getIntervalCount(), saved.getStartDate());
        return saved;
    }

    public List<RecurringSeries> list() {
        return seriesRepo.findAllByOrderByCreatedAtDesc();
    }

    public Optional<RecurringSeries> find(UUID seriesId) {
        return seriesRepo.findById(seriesId);
    }

    public List<RecurringInstance> instances(UUID seriesId) {
        return instanceRepo.findBySeriesIdOrderByOccurrenceDateAsc(seriesId);
    }

    @Transactional
    public RecurringSeries setActive(UUID seriesId, boolean active) {
        RecurringSeries series = seriesRepo.findById(seriesId).orElseThrow(() ->
                new NoSuchElementException("Recurring series " + seriesId + " not found"));
        series.setActive(active);
        return seriesRepo.save(series);
    }

    /**
     * Close a visit that has not become a job yet.
     *
     * @throws NoSuchElementException if the instance does not belong to the series
     * @throws IllegalStateException  if the instance is no longer PENDING
     */
    @Transactional
    public RecurringInstance closeInstance(UUID seriesId, UUID instanceId, InstanceStatus closedAs) {
        RecurringInstance instance = instanceRepo.findByIdAndSeriesId(instanceId, seriesId).orElseThrow(() ->
                new NoSuchElementException("Instance " + instanceId + " not found in series " + seriesId));
        instance.close(closedAs);
        log.info("Series {} visit on {} marked {}", seriesId, instance.getOccurrenceDate(), closedAs);
        return instanceRepo.save(instance);
    }
}
