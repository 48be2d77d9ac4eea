package com.fieldpilot.lifecycle.automation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldpilot.lifecycle.event.LifecycleEvent;
import com.fieldpilot.lifecycle.model.AutomationRule;
import com.fieldpilot.lifecycle.repository.AutomationRuleRepository;
import com.fieldpilot.lifecycle.repository.AutomationRunRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutomationAdminServiceTest {

    @Mock AutomationRuleRepository ruleRepo;
    @Mock AutomationRunRepository  runRepo;

    AutomationAdminService service;

    @BeforeEach
    void setUp() {
        AutomationAction notify = new AutomationAction() {
            @Override public String name() { return "send_notification"; }
            @Override public ActionResult execute(ActionContext ctx) { return ActionResult.ok("sent"); }
        };
        service = new AutomationAdminService(ruleRepo, runRepo,
                new ActionRegistry(List.of(notify), new SimpleMeterRegistry()),
                new RuleDefinitionCodec(new ObjectMapper()));
    }

    @Test
    void create_storesDefinitionAsJsonAndAppliesOverrides() {
        when(ruleRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        AutomationRule rule = service.create(definition(LifecycleEvent.JOB_SCHEDULED, "send_notification", 3));

        assertThat(rule.getTriggerEvent()).isEqualTo("job_scheduled");
        assertThat(rule.getMaxFirings()).isEqualTo(3);
        assertThat(rule.getWindowMinutes()).isEqualTo(60);
        assertThat(service.conditionsOf(rule)).containsExactly(new RuleCondition("seriesId", "is_not_empty", null));
        assertThat(service.actionsOf(rule)).singleElement()
                .satisfies(a -> assertThat(a.config()).containsEntry("template", "visit_reminder"));
    }

    @Test
    void create_rejectsUnknownTriggerActionAndBadGuard() {
        assertThatThrownBy(() -> service.create(definition("job_deleted", "send_notification", null)))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("trigger");
        assertThatThrownBy(() -> service.create(definition(LifecycleEvent.JOB_CREATED, "launch_rocket", null)))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("launch_rocket");
        assertThatThrownBy(() -> service.create(definition(LifecycleEvent.JOB_CREATED, "send_notification", 0)))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxFirings");
        verify(ruleRepo, never()).save(any());
    }

    @Test
    void create_rejectsRuleWithoutActions() {
        RuleDefinition empty = new RuleDefinition("noop", null, LifecycleEvent.JOB_CREATED,
                List.of(), List.of(), null, null, null, null);

        assertThatThrownBy(() -> service.create(empty)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setEnabled_unknownRule_isNotFound() {
        UUID id = UUID.randomUUID();
        when(ruleRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.setEnabled(id, false)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void runs_filtersByEventThenJob() {
        UUID eventId = UUID.randomUUID();
        UUID jobId = UUID.randomUUID();
        when(runRepo.findByEventIdOrderByFiredAtAsc(eventId)).thenReturn(List.of());

        assertThat(service.runs(jobId, eventId)).isEmpty();
        service.runs(jobId, null);
        service.runs(null, null);

        verify(runRepo).findByJobIdOrderByFiredAtAsc(jobId);
        verify(runRepo).findTop100ByOrderByFiredAtDesc();
    }

    private static RuleDefinition definition(String trigger, String action, Integer maxFirings) {
        return new RuleDefinition("Visit reminder", "remind the client", trigger,
                List.of(new RuleCondition("seriesId", "is_not_empty", null)),
                List.of(new ActionSpec(action, Map.of("template", "visit_reminder"))),
                null, maxFirings, null, 50);
    }
}
