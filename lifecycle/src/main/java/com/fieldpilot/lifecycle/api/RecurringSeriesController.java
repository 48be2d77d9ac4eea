package com.fieldpilot.lifecycle.api;

import com.fieldpilot.lifecycle.api.dto.InstanceResponse;
import com.fieldpilot.lifecycle.api.dto.SeriesRequest;
import com.fieldpilot.lifecycle.api.dto.SeriesResponse;
import com.fieldpilot.lifecycle.model.InstanceStatus;
import com.fieldpilot.lifecycle.model.RecurringSeries;
import com.fieldpilot.lifecycle.recurrence.GenerationSummary;
import com.fieldpilot.lifecycle.recurrence.RecurrenceGenerator;
import com.fieldpilot.lifecycle.service.RecurringSeriesService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST API for recurring maintenance series.
 *
 * GET/POST /recurring-series
 * GET      /recurring-series/{id}
 * POST     /recurring-series/{id}/activate | /deactivate
 * GET      /recurring-series/{id}/instances
 * POST     /recurring-series/{id}/generate             run the generator for this series now
 * POST     /recurring-series/{id}/instances/{iid}/skip | /cancel
 */
@RestController
@RequestMapping("/recurring-series")
public class RecurringSeriesController {

    private final RecurringSeriesService series;
    private final RecurrenceGenerator    generator;
    private final Clock                  clock;

    public RecurringSeriesController(RecurringSeriesService series, RecurrenceGenerator generator, Clock clock) {
        this.series    = series;
        this.generator = generator;
        this.clock     = clock;
    }

    @GetMapping
    public List<SeriesResponse> list() {
        return series.list().stream().map(SeriesResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<SeriesResponse> create(@RequestBody SeriesRequest req) {
        RecurringSeries created = series.create(req.toNewSeries());
        return ResponseEntity.status(HttpStatus.CREATED).body(SeriesResponse.from(created));
    }

    @GetMapping("/{id}")
    public SeriesResponse get(@PathVariable UUID id) {
        return SeriesResponse.from(require(id));
    }

    @PostMapping("/{id}/activate")
    public SeriesResponse activate(@PathVariable UUID id) {
        return SeriesResponse.from(series.setActive(id, true));
    }

    @PostMapping("/{id}/deactivate")
    public SeriesResponse deactivate(@PathVariable UUID id) {
        return SeriesResponse.from(series.setActive(id, false));
    }

    @GetMapping("/{id}/instances")
    public List<InstanceResponse> instances(@PathVariable UUID id) {
        require(id);
        return series.instances(id).stream().map(InstanceResponse::from).toList();
    }

    @PostMapping("/{id}/generate")
    public GenerationSummary generate(@PathVariable UUID id) {
        return generator.generate(require(id), LocalDate.now(clock));
    }

    @PostMapping("/{id}/instances/{instanceId}/skip")
    public InstanceResponse skip(@PathVariable UUID id, @PathVariable UUID instanceId) {
        return InstanceResponse.from(series.closeInstance(id, instanceId, InstanceStatus.SKIPPED));
    }

    @PostMapping("/{id}/instances/{instanceId}/cancel")
    public InstanceResponse cancel(@PathVariable UUID id, @PathVariable UUID instanceId) {
        return InstanceResponse.from(series.closeInstance(id, instanceId, InstanceStatus.CANCELLED));
    }

    private RecurringSeries require(UUID id) {
        return series.find(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Recurring series not found: " + id));
    }
}
