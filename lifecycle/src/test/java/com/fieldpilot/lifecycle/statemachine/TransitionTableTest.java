package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionTableTest {

    private final TransitionTable table = TransitionTable.standard();

    @Test
    void everyNonTerminalState_canBeCancelled() {
        for (JobState state : JobState.values()) {
            if (state.isTerminal()) continue;
            assertThat(table.rule(state, JobState.CANCELLED))
                    .as("cancel edge from %s", state)
                    .hasValueSatisfying(r -> assertThat(r.roles()).contains(Role.SALES, Role.SYSTEM));
        }
    }

    @Test
    void terminalStates_haveNoOutgoingEdges() {
        assertThat(table.rulesFrom(JobState.PAID)).isEmpty();
        assertThat(table.rulesFrom(JobState.CANCELLED)).isEmpty();
    }

    @Test
    void scheduledCannotJumpStraightToCompleted() {
        assertThat(table.rule(JobState.SCHEDULED, JobState.COMPLETED)).isEmpty();
    }

    @Test
    void weatherHoldAndInvoiceVoid_requireReason() {
        Set<JobState> holdSources = EnumSet.of(JobState.SCHEDULED, JobState.EN_ROUTE, JobState.ON_SITE, JobState.IN_PROGRESS);
        for (JobState from : holdSources) {
            assertThat(table.rule(from, JobState.WEATHER_HOLD)).hasValueSatisfying(r -> assertThat(r.reasonRequired()).isTrue());
        }
        assertThat(table.rule(JobState.INVOICED, JobState.COMPLETED)).hasValueSatisfying(r -> assertThat(r.reasonRequired()).isTrue());
        assertThat(table.rule(JobState.DRAFT, JobState.SCHEDULED)).hasValueSatisfying(r -> assertThat(r.reasonRequired()).isFalse());
    }

    @Test
    void adminIsPermittedOnEveryEdge_crewOnlyOnFieldEdges() {
        for (TransitionRule rule : table.allRules()) {
            assertThat(rule.permits(Role.ADMIN)).as("%s -> %s", rule.from(), rule.to()).isTrue();
        }
        assertThat(table.rule(JobState.DRAFT, JobState.SCHEDULED).orElseThrow().permits(Role.CREW)).isFalse();
        assertThat(table.rule(JobState.IN_PROGRESS, JobState.COMPLETED).orElseThrow().permits(Role.CREW)).isTrue();
        assertThat(table.rule(JobState.COMPLETED, JobState.INVOICED).orElseThrow().permits(Role.SYSTEM)).isTrue();
    }

    @Test
    void completionCarriesInvoiceHook() {
        assertThat(table.rule(JobState.IN_PROGRESS, JobState.COMPLETED).orElseThrow().hooks())
                .containsExactly("create_invoice");
    }

    @Test
    void builder_rejectsEdgesOutOfTerminalStates() {
        assertThatThrownBy(() -> TransitionTable.builder("test")
                .edge(JobState.PAID, JobState.INVOICED, EnumSet.of(Role.SALES)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void standardTable_isVersioned() {
        assertThat(table.version()).isEqualTo(TransitionTable.STANDARD_VERSION);
    }
}
