package com.fieldpilot.lifecycle.api;

import com.fieldpilot.lifecycle.model.Actor;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;
import com.fieldpilot.lifecycle.model.StateTransition;
import com.fieldpilot.lifecycle.model.TransitionSource;
import com.fieldpilot.lifecycle.service.JobIntakeService;
import com.fieldpilot.lifecycle.statemachine.JobStateMachine;
import com.fieldpilot.lifecycle.statemachine.TransitionException;
import com.fieldpilot.lifecycle.statemachine.TransitionResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.fieldpilot.lifecycle.repository.InMemoryJobStore.setField;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * @WebMvcTest spins up only the web layer and the exception handler; the
 * services are mocks.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    private static final Instant NOW = Instant.parse("2025-05-05T09:00:00Z");

    @Autowired MockMvc mockMvc;
    @MockitoBean JobIntakeService intake;
    @MockitoBean JobStateMachine  stateMachine;

    // ------------------------------------------------------------------
    // POST /jobs, GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void openJob_returns201InDraft() throws Exception {
        Job job = fakeJob(JobState.DRAFT);
        when(intake.openJob(any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"clientId":"%s","title":"Spring cleanup",
                                 "costPayload":{"lineItems":[{"price":100,"quantity":2}]}}
                                """.formatted(job.getClientId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(job.getId().toString()))
                .andExpect(jsonPath("$.state").value("draft"))
                .andExpect(jsonPath("$.stateLabel").value("Draft"));
    }

    @Test
    void openJob_missingTitle_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"clientId":"%s"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("BAD_REQUEST"));
        verify(intake, never()).openJob(any());
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(intake.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/{id}", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/transitions
    // ------------------------------------------------------------------

    @Test
    void transition_applied_returns200WithNewState() throws Exception {
        UUID jobId = UUID.randomUUID();
        UUID transitionId = UUID.randomUUID();
        when(stateMachine.requestTransition(eq(jobId), eq(JobState.COMPLETED), any(), any()))
                .thenReturn(new TransitionResult(jobId, JobState.IN_PROGRESS, JobState.COMPLETED, transitionId, NOW));

        mockMvc.perform(post("/jobs/{id}/transitions", jobId)
                        .header("X-Actor-Id", "u-crew")
                        .header("X-Actor-Role", "crew")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"toState":"completed"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fromState").value("in_progress"))
                .andExpect(jsonPath("$.state").value("completed"))
                .andExpect(jsonPath("$.transitionId").value(transitionId.toString()));
        verify(stateMachine).requestTransition(jobId, JobState.COMPLETED, new Actor("u-crew", Role.CREW), null);
    }

    @Test
    void transition_rejections_mapToStatusCodes() throws Exception {
        assertRejection(TransitionException.Kind.JOB_NOT_FOUND, 404);
        assertRejection(TransitionException.Kind.INVALID_TRANSITION, 409);
        assertRejection(TransitionException.Kind.FORBIDDEN, 403);
        assertRejection(TransitionException.Kind.PRECONDITION_FAILED, 422);
        assertRejection(TransitionException.Kind.CONCURRENT_MODIFICATION, 409);
    }

    @Test
    void transition_preconditionFailure_listsBlockers() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(stateMachine.requestTransition(eq(jobId), any(), any(), any()))
                .thenThrow(new TransitionException(TransitionException.Kind.PRECONDITION_FAILED, jobId,
                        "Job is not ready for Scheduled", List.of("scheduled start is required")));

        perform(jobId, "scheduled")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("PRECONDITION_FAILED"))
                .andExpect(jsonPath("$.details[0]").value("scheduled start is required"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void transition_unknownRoleOrState_returns400() throws Exception {
        UUID jobId = UUID.randomUUID();

        mockMvc.perform(post("/jobs/{id}/transitions", jobId)
                        .header("X-Actor-Id", "u-1")
                        .header("X-Actor-Role", "janitor")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"toState\":\"completed\"}"))
                .andExpect(status().isBadRequest());
        perform(jobId, "teleported")
                .andExpect(status().isBadRequest());
        verify(stateMachine, never()).requestTransition(any(), any(), any(), any());
    }

    @Test
    void transition_missingActorHeaders_returns400() throws Exception {
        mockMvc.perform(post("/jobs/{id}/transitions", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"toState\":\"completed\"}"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // History and allowed transitions
    // ------------------------------------------------------------------

    @Test
    void history_returnsAuditRowsInOrder() throws Exception {
        Job job = fakeJob(JobState.DRAFT);
        StateTransition first  = job.transitionTo(JobState.SCHEDULED, new Actor("u-sales", Role.SALES),
                null, TransitionSource.MANUAL, "2025.2", NOW);
        StateTransition second = job.transitionTo(JobState.WEATHER_HOLD, new Actor("u-crew", Role.CREW),
                "storm", TransitionSource.MANUAL, "2025.2", NOW.plusSeconds(60));
        when(stateMachine.history(job.getId())).thenReturn(List.of(first, second));

        mockMvc.perform(get("/jobs/{id}/transitions", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toState").value("scheduled"))
                .andExpect(jsonPath("$[0].actorRole").value("sales"))
                .andExpect(jsonPath("$[1].fromState").value("scheduled"))
                .andExpect(jsonPath("$[1].reason").value("storm"))
                .andExpect(jsonPath("$[1].tableVersion").value("2025.2"));
    }

    @Test
    void allowedTransitions_returnsWireNames() throws Exception {
        Job job = fakeJob(JobState.SCHEDULED);
        when(intake.findById(job.getId())).thenReturn(Optional.of(job));
        when(stateMachine.allowedTransitions(eq(job.getId()), any()))
                .thenReturn(List.of(JobState.EN_ROUTE, JobState.IN_PROGRESS, JobState.WEATHER_HOLD));
        when(stateMachine.tableVersion()).thenReturn("2025.2");

        mockMvc.perform(get("/jobs/{id}/allowed-transitions", job.getId())
                        .header("X-Actor-Id", "u-crew")
                        .header("X-Actor-Role", "CREW"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentState").value("scheduled"))
                .andExpect(jsonPath("$.allowed[0]").value("en_route"))
                .andExpect(jsonPath("$.allowed.length()").value(3))
                .andExpect(jsonPath("$.tableVersion").value("2025.2"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void assertRejection(TransitionException.Kind kind, int httpStatus) throws Exception {
        UUID jobId = UUID.randomUUID();
        when(stateMachine.requestTransition(eq(jobId), any(), any(), any()))
                .thenThrow(new TransitionException(kind, jobId, "rejected: " + kind));

        perform(jobId, "invoiced")
                .andExpect(status().is(httpStatus))
                .andExpect(jsonPath("$.kind").value(kind.name()))
                .andExpect(jsonPath("$.retryable").value(kind == TransitionException.Kind.CONCURRENT_MODIFICATION));
    }

    private ResultActions perform(UUID jobId, String toState) throws Exception {
        return mockMvc.perform(post("/jobs/{id}/transitions", jobId)
                .header("X-Actor-Id", "u-sales")
                .header("X-Actor-Role", "sales")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"toState\":\"" + toState + "\"}"));
    }

    private static Job fakeJob(JobState state) {
        Job job = new Job(UUID.randomUUID(), "Spring cleanup");
        setField(job, "id", UUID.randomUUID());
        setField(job, "state", state);
        return job;
    }
}
