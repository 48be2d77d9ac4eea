package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.model.StateTransition;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

public record TransitionHistoryEntry(
        UUID    id,
        String  fromState,
        String  toState,
        String  actorId,
        String  actorRole,
        boolean systemTriggered,
        String  source,
        String  reason,
        String  tableVersion,
        Instant createdAt
) {
    public static TransitionHistoryEntry from(StateTransition t) {
        return new TransitionHistoryEntry(
                t.getId(),
                t.getFromState().wireName(),
                t.getToState().wireName(),
                t.getActorId(),
                t.getActorRole().name().toLowerCase(Locale.ROOT),
                t.isSystemTriggered(),
                t.getSource().name().toLowerCase(Locale.ROOT),
                t.getReason(),
                t.getTableVersion(),
                t.getCreatedAt()
        );
    }
}
