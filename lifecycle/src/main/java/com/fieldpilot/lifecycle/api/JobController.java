package com.fieldpilot.lifecycle.api;

import com.fieldpilot.lifecycle.api.dto.AllowedTransitionsResponse;
import com.fieldpilot.lifecycle.api.dto.JobResponse;
import com.fieldpilot.lifecycle.api.dto.OpenJobRequest;
import com.fieldpilot.lifecycle.api.dto.ScheduleRequest;
import com.fieldpilot.lifecycle.api.dto.TransitionHistoryEntry;
import com.fieldpilot.lifecycle.api.dto.TransitionRequest;
import com.fieldpilot.lifecycle.api.dto.TransitionResponse;
import com.fieldpilot.lifecycle.model.Actor;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;
import com.fieldpilot.lifecycle.service.JobIntakeService;
import com.fieldpilot.lifecycle.statemachine.JobStateMachine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST API for the job lifecycle.
 *
 * POST /jobs                           open a job in Draft
 * GET  /jobs/{id}                      current state and scheduling data
 * PUT  /jobs/{id}/schedule             set visit window and crew
 * POST /jobs/{id}/transitions          request a state change
 * GET  /jobs/{id}/transitions          audit history, oldest first
 * GET  /jobs/{id}/allowed-transitions  what the caller may do next
 *
 * The caller's identity arrives from the auth gateway as X-Actor-Id and
 * X-Actor-Role; this service only checks the role.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    static final String ACTOR_ID   = "X-Actor-Id";
    static final String ACTOR_ROLE = "X-Actor-Role";

    private final JobIntakeService intake;
    private final JobStateMachine  stateMachine;

    public JobController(JobIntakeService intake, JobStateMachine stateMachine) {
        this.intake       = intake;
        this.stateMachine = stateMachine;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"clientId":"5f0c...","title":"Spring cleanup"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> open(@RequestBody OpenJobRequest req) {
        Job job = intake.openJob(req.toNewJob());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return intake.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    @PutMapping("/{id}/schedule")
    public JobResponse schedule(@PathVariable UUID id, @RequestBody ScheduleRequest req) {
        return JobResponse.from(intake.updateSchedule(id, req.scheduledStart(), req.scheduledEnd(), req.assignedCrew()));
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/jobs/{id}/transitions \
     *     -H "X-Actor-Id: u-17" -H "X-Actor-Role: crew" \
     *     -H "Content-Type: application/json" \
     *     -d '{"toState":"weather_hold","reason":"lightning"}'
     *
     * HTTP 200 on success; 403/404/409/422 on rejection, job left unchanged
     */
    @PostMapping("/{id}/transitions")
    public TransitionResponse transition(@PathVariable UUID id,
                                         @RequestHeader(ACTOR_ID) String actorId,
                                         @RequestHeader(ACTOR_ROLE) String actorRole,
                                         @RequestBody TransitionRequest req) {
        JobState target = JobState.parse(req.toState());
        return TransitionResponse.from(
                stateMachine.requestTransition(id, target, actor(actorId, actorRole), req.reason()));
    }

    @GetMapping("/{id}/transitions")
    public List<TransitionHistoryEntry> history(@PathVariable UUID id) {
        return stateMachine.history(id).stream()
                .map(TransitionHistoryEntry::from)
                .toList();
    }

    @GetMapping("/{id}/allowed-transitions")
    public AllowedTransitionsResponse allowed(@PathVariable UUID id,
                                              @RequestHeader(ACTOR_ID) String actorId,
                                              @RequestHeader(ACTOR_ROLE) String actorRole) {
        List<String> allowed = stateMachine.allowedTransitions(id, actor(actorId, actorRole)).stream()
                .map(JobState::wireName)
                .toList();
        String current = intake.findById(id).map(j -> j.getState().wireName()).orElse(null);
        return new AllowedTransitionsResponse(id, current, allowed, stateMachine.tableVersion());
    }

    static Actor actor(String id, String role) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(ACTOR_ID + " must not be blank");
        }
        try {
            return new Actor(id.trim(), Role.valueOf(role.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role '" + role + "' in " + ACTOR_ROLE);
        }
    }
}
