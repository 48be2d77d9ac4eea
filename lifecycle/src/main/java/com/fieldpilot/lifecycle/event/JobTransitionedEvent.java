package com.fieldpilot.lifecycle.event;

import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;
import com.fieldpilot.lifecycle.model.StateTransition;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.UUID;

public record JobTransitionedEvent(
        UUID         eventId,
        UUID         jobId,
        UUID         clientId,
        JobState     fromState,
        JobState     toState,
        String       actorId,
        Role         actorRole,
        boolean      systemTriggered,
        String       reason,
        List<String> hooks,
        UUID         transitionId,
        Instant      occurredAt) implements LifecycleEvent {

    public JobTransitionedEvent {
        hooks = List.copyOf(hooks);
    }

    public static JobTransitionedEvent of(Job job, StateTransition transition, List<String> hooks) {
        return new JobTransitionedEvent(
                UUID.randomUUID(),
                job.getId(),
                job.getClientId(),
                transition.getFromState(),
                transition.getToState(),
                transition.getActorId(),
                transition.getActorRole(),
                transition.isSystemTriggered(),
                transition.getReason(),
                hooks,
                transition.getId(),
                transition.getCreatedAt());
    }

    @Override
    public String type() {
        return JOB_TRANSITIONED;
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("jobId", jobId.toString());
        p.put("clientId", clientId == null ? null : clientId.toString());
        p.put("fromState", fromState.wireName());
        p.put("toState", toState.wireName());
        p.put("actorId", actorId);
        p.put("actorRole", actorRole.name().toLowerCase(Locale.ROOT));
        p.put("systemTriggered", systemTriggered);
        p.put("reason", reason);
        p.put("hooks", hooks);
        p.put("transitionId", transitionId == null ? null : transitionId.toString());
        p.put("timestamp", occurredAt.toString());
        return Collections.unmodifiableMap(p);
    }
}
