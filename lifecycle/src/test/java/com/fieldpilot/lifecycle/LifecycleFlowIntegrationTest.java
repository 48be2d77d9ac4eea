package com.fieldpilot.lifecycle;

import com.fieldpilot.lifecycle.automation.AutomationEngine;
import com.fieldpilot.lifecycle.event.EventBus;
import com.fieldpilot.lifecycle.event.JobTransitionedEvent;
import com.fieldpilot.lifecycle.model.Actor;
import com.fieldpilot.lifecycle.model.AutomationRun;
import com.fieldpilot.lifecycle.model.Client;
import com.fieldpilot.lifecycle.model.ClientCategory;
import com.fieldpilot.lifecycle.model.Invoice;
import com.fieldpilot.lifecycle.model.InvoiceStatus;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.RecurrenceFrequency;
import com.fieldpilot.lifecycle.model.RecurringInstance;
import com.fieldpilot.lifecycle.model.RecurringSeries;
import com.fieldpilot.lifecycle.model.Role;
import com.fieldpilot.lifecycle.model.RunStatus;
import com.fieldpilot.lifecycle.model.StateTransition;
import com.fieldpilot.lifecycle.recurrence.GenerationSummary;
import com.fieldpilot.lifecycle.recurrence.RecurrenceGenerator;
import com.fieldpilot.lifecycle.repository.AutomationRunRepository;
import com.fieldpilot.lifecycle.repository.ClientRepository;
import com.fieldpilot.lifecycle.repository.InvoiceRepository;
import com.fieldpilot.lifecycle.service.JobIntakeService;
import com.fieldpilot.lifecycle.service.NewJob;
import com.fieldpilot.lifecycle.service.NewSeries;
import com.fieldpilot.lifecycle.service.RecurringSeriesService;
import com.fieldpilot.lifecycle.statemachine.JobStateMachine;
import com.fieldpilot.lifecycle.statemachine.TransitionException;
import com.fieldpilot.lifecycle.statemachine.TransitionResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end flow against H2 with the Flyway schema and the seeded rules:
 * state machine, event bus, automation engine and actions wired together.
 */
@SpringBootTest
@ActiveProfiles("test")
class LifecycleFlowIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Autowired JobIntakeService        intake;
    @Autowired JobStateMachine         stateMachine;
    @Autowired AutomationEngine        automation;
    @Autowired EventBus                eventBus;
    @Autowired ClientRepository        clients;
    @Autowired InvoiceRepository       invoices;
    @Autowired AutomationRunRepository runs;
    @Autowired RecurringSeriesService  seriesService;
    @Autowired RecurrenceGenerator     generator;

    private final Actor sales = new Actor("u-sales", Role.SALES);
    private final Actor crew  = new Actor("u-crew", Role.CREW);

    @Test
    void completedJob_getsDraftInvoiceAndActivatesClient() throws Exception {
        Client client = client(ClientCategory.POTENTIAL);
        Job job = openScheduledReadyJob(client);

        walkToCompleted(job.getId());
        drainEvents();

        Invoice invoice = invoices.findByJobId(job.getId()).orElseThrow();
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
        assertThat(invoice.getAmount()).isEqualByComparingTo(new BigDecimal("450.00"));
        assertThat(invoice.getClientId()).isEqualTo(client.getId());
        assertThat(clients.findById(client.getId()).orElseThrow().getCategory()).isEqualTo(ClientCategory.ACTIVE);

        List<AutomationRun> jobRuns = runs.findByJobIdOrderByFiredAtAsc(job.getId());
        assertThat(jobRuns).singleElement().satisfies(run -> {
            assertThat(run.getRuleName()).isEqualTo("Invoice and activate client on completion");
            assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        });

        List<StateTransition> history = stateMachine.history(job.getId());
        assertThat(history).extracting(StateTransition::getToState).containsExactly(
                JobState.SCHEDULED, JobState.EN_ROUTE, JobState.ON_SITE, JobState.IN_PROGRESS, JobState.COMPLETED);
    }

    @Test
    void scheduledJob_cannotSkipToCompleted_butCompletesThroughInProgress() throws Exception {
        Client client = client(ClientCategory.POTENTIAL);
        Job job = openScheduledReadyJob(client);

        TransitionResult scheduled = stateMachine.requestTransition(job.getId(), JobState.SCHEDULED, sales, null);
        assertThat(scheduled.state()).isEqualTo(JobState.SCHEDULED);
        assertThat(stateMachine.history(job.getId())).singleElement().satisfies(t -> {
            assertThat(t.getFromState()).isEqualTo(JobState.DRAFT);
            assertThat(t.getToState()).isEqualTo(JobState.SCHEDULED);
        });

        assertThatThrownBy(() -> stateMachine.requestTransition(job.getId(), JobState.COMPLETED, crew, null))
                .isInstanceOfSatisfying(TransitionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TransitionException.Kind.INVALID_TRANSITION));
        assertThat(intake.findById(job.getId()).orElseThrow().getState()).isEqualTo(JobState.SCHEDULED);

        stateMachine.requestTransition(job.getId(), JobState.IN_PROGRESS, crew, null);
        stateMachine.requestTransition(job.getId(), JobState.COMPLETED, crew, null);
        drainEvents();

        assertThat(stateMachine.history(job.getId())).extracting(StateTransition::getToState)
                .containsExactly(JobState.SCHEDULED, JobState.IN_PROGRESS, JobState.COMPLETED);
        assertThat(invoices.countByJobId(job.getId())).isEqualTo(1);
        assertThat(invoices.findByJobId(job.getId()).orElseThrow().getStatus()).isEqualTo(InvoiceStatus.DRAFT);
        assertThat(clients.findById(client.getId()).orElseThrow().getCategory()).isEqualTo(ClientCategory.ACTIVE);
    }

    @Test
    void redeliveredCompletion_recordsTwoRunsButOneInvoice() throws Exception {
        Client client = client(ClientCategory.POTENTIAL);
        Job job = openScheduledReadyJob(client);
        walkToCompleted(job.getId());
        drainEvents();

        StateTransition completed = last(stateMachine.history(job.getId()));
        JobTransitionedEvent event = JobTransitionedEvent.of(
                intake.findById(job.getId()).orElseThrow(), completed, List.of("create_invoice"));
        automation.onEvent(event);
        automation.onEvent(event);

        assertThat(runs.findByEventIdOrderByFiredAtAsc(event.eventId()))
                .hasSize(2)
                .allSatisfy(run -> assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCEEDED));
        assertThat(invoices.countByJobId(job.getId())).isEqualTo(1);
    }

    @Test
    void payment_marksInvoicePaid() throws Exception {
        Client client = client(ClientCategory.POTENTIAL);
        Job job = openScheduledReadyJob(client);
        walkToCompleted(job.getId());
        drainEvents();

        stateMachine.requestTransition(job.getId(), JobState.INVOICED, Actor.system("billing"), null);
        stateMachine.requestTransition(job.getId(), JobState.PAID, sales, null);
        drainEvents();

        assertThat(invoices.findByJobId(job.getId()).orElseThrow().getStatus()).isEqualTo(InvoiceStatus.PAID);
        assertThatThrownBy(() -> stateMachine.requestTransition(job.getId(), JobState.CANCELLED, sales, null))
                .isInstanceOfSatisfying(TransitionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(TransitionException.Kind.INVALID_TRANSITION));
    }

    @Test
    void cancellingOnlyJob_downgradesClient() throws Exception {
        Client client = client(ClientCategory.ACTIVE);
        Job job = openScheduledReadyJob(client);

        stateMachine.requestTransition(job.getId(), JobState.CANCELLED, sales, "client moved away");
        drainEvents();

        assertThat(clients.findById(client.getId()).orElseThrow().getCategory()).isEqualTo(ClientCategory.POTENTIAL);
    }

    @Test
    void cancellingOneOfSeveralJobs_keepsClientActive() throws Exception {
        Client client = client(ClientCategory.ACTIVE);
        Job cancelled = openScheduledReadyJob(client);
        openScheduledReadyJob(client);

        stateMachine.requestTransition(cancelled.getId(), JobState.CANCELLED, sales, null);
        drainEvents();

        assertThat(clients.findById(client.getId()).orElseThrow().getCategory()).isEqualTo(ClientCategory.ACTIVE);
    }

    @Test
    void rejectedTransition_leavesJobAndHistoryUntouched() {
        Job job = openScheduledReadyJob(client(ClientCategory.POTENTIAL));

        assertThatThrownBy(() -> stateMachine.requestTransition(job.getId(), JobState.COMPLETED, crew, null))
                .isInstanceOf(TransitionException.class);

        assertThat(intake.findById(job.getId()).orElseThrow().getState()).isEqualTo(JobState.DRAFT);
        assertThat(stateMachine.history(job.getId())).isEmpty();
    }

    @Test
    void recurringSeries_materializesDraftJobsOnce() {
        Client client = client(ClientCategory.ACTIVE);
        LocalDate today = LocalDate.now();
        RecurringSeries series = seriesService.create(new NewSeries(client.getId(), null, "Weekly mowing",
                RecurrenceFrequency.WEEKLY, 1, today.getDayOfWeek(), null, today, null,
                List.of("crew-3"), LocalTime.of(8, 0), 1.0, null));

        GenerationSummary first  = generator.generate(series, today);
        GenerationSummary second = generator.generate(series, today);

        assertThat(first.instancesCreated()).isGreaterThanOrEqualTo(8);
        assertThat(first.jobsMaterialized()).isEqualTo(2);
        assertThat(second.instancesCreated()).isZero();
        assertThat(second.jobsMaterialized()).isZero();

        RecurringInstance todays = seriesService.instances(series.getId()).get(0);
        assertThat(todays.getOccurrenceDate()).isEqualTo(today);
        Job job = intake.findById(todays.getJobId()).orElseThrow();
        assertThat(job.getState()).isEqualTo(JobState.DRAFT);
        assertThat(job.getSeriesId()).isEqualTo(series.getId());
        assertThat(job.getAssignedCrew()).containsExactly("crew-3");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Client client(ClientCategory category) {
        Client client = new Client(UUID.randomUUID(), "Client " + UUID.randomUUID());
        client.setCategory(category);
        return clients.save(client);
    }

    private Job openScheduledReadyJob(Client client) {
        Instant start = Instant.now().plus(Duration.ofDays(1));
        return intake.openJob(new NewJob(client.getId(), null, "Garden renovation",
                start, start.plus(Duration.ofHours(6)), List.of("crew-1", "crew-2"),
                "{\"lineItems\":[{\"description\":\"Sod\",\"price\":150,\"quantity\":2},"
                        + "{\"description\":\"Labour\",\"price\":\"75.00\",\"quantity\":2}]}"));
    }

    private void walkToCompleted(UUID jobId) {
        stateMachine.requestTransition(jobId, JobState.SCHEDULED, sales, null);
        stateMachine.requestTransition(jobId, JobState.EN_ROUTE, crew, null);
        stateMachine.requestTransition(jobId, JobState.ON_SITE, crew, null);
        stateMachine.requestTransition(jobId, JobState.IN_PROGRESS, crew, null);
        stateMachine.requestTransition(jobId, JobState.COMPLETED, crew, null);
    }

    /** Twice: actions may publish follow-up events while the first pass drains. */
    private void drainEvents() throws InterruptedException {
        assertThat(eventBus.flush(WAIT)).isTrue();
        assertThat(eventBus.flush(WAIT)).isTrue();
    }

    private static StateTransition last(List<StateTransition> history) {
        return history.get(history.size() - 1);
    }
}
