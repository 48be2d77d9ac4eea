package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static, versioned map of (from, to) → {@link TransitionRule}.
 *
 * Pure data: built once, never mutated. Changing an edge means changing
 * {@link #standard()} and bumping {@link #STANDARD_VERSION}; the version is
 * written onto every audit row so history stays interpretable.
 *
 * Invariants enforced at build time:
 *   - terminal states (PAID, CANCELLED) have no outgoing edges
 *   - every non-terminal state has an edge to CANCELLED
 */
public final class TransitionTable {

    public static final String STANDARD_VERSION = "2025.2";

    private static final Set<Role> SALES        = EnumSet.of(Role.SALES);
    private static final Set<Role> CREW         = EnumSet.of(Role.CREW);
    private static final Set<Role> FIELD_OR_OFFICE = EnumSet.of(Role.CREW, Role.SALES);
    private static final Set<Role> BILLING      = EnumSet.of(Role.SALES, Role.SYSTEM);

    private final String version;
    private final Map<JobState, Map<JobState, TransitionRule>> edges;

    private TransitionTable(String version, Map<JobState, Map<JobState, TransitionRule>> edges) {
        this.version = version;
        this.edges   = edges;
    }

    public String version() { return version; }

    public Optional<TransitionRule> rule(JobState from, JobState to) {
        return Optional.ofNullable(edges.getOrDefault(from, Map.of()).get(to));
    }

    /** Outgoing rules of a state in declaration order; empty for terminal states. */
    public List<TransitionRule> rulesFrom(JobState from) {
        return List.copyOf(edges.getOrDefault(from, Map.of()).values());
    }

    public List<TransitionRule> allRules() {
        List<TransitionRule> all = new ArrayList<>();
        edges.values().forEach(m -> all.addAll(m.values()));
        return all;
    }

    // ------------------------------------------------------------------
    // The production table
    // ------------------------------------------------------------------

    public static TransitionTable standard() {
        return builder(STANDARD_VERSION)
                .edge(JobState.DRAFT, JobState.NEEDS_PERMIT, SALES)
                .edge(JobState.DRAFT, JobState.WAITING_ON_CLIENT, SALES)
                .edge(JobState.DRAFT, JobState.SCHEDULED, SALES, "notify_crew")
                .edge(JobState.NEEDS_PERMIT, JobState.WAITING_ON_CLIENT, SALES)
                .edge(JobState.NEEDS_PERMIT, JobState.SCHEDULED, SALES, "notify_crew")
                .edge(JobState.WAITING_ON_CLIENT, JobState.SCHEDULED, SALES, "notify_crew")
                .edge(JobState.SCHEDULED, JobState.EN_ROUTE, CREW, "notify_client")
                .edge(JobState.SCHEDULED, JobState.IN_PROGRESS, CREW)
                .edge(JobState.EN_ROUTE, JobState.ON_SITE, CREW)
                .edge(JobState.ON_SITE, JobState.IN_PROGRESS, CREW)
                .reasonedEdge(JobState.SCHEDULED, JobState.WEATHER_HOLD, FIELD_OR_OFFICE, "notify_client")
                .reasonedEdge(JobState.EN_ROUTE, JobState.WEATHER_HOLD, FIELD_OR_OFFICE, "notify_client")
                .reasonedEdge(JobState.ON_SITE, JobState.WEATHER_HOLD, FIELD_OR_OFFICE, "notify_client")
                .reasonedEdge(JobState.IN_PROGRESS, JobState.WEATHER_HOLD, FIELD_OR_OFFICE, "notify_client")
                .edge(JobState.WEATHER_HOLD, JobState.SCHEDULED, SALES, "notify_crew")
                .edge(JobState.IN_PROGRESS, JobState.COMPLETED, CREW, "create_invoice")
                .edge(JobState.COMPLETED, JobState.INVOICED, BILLING)
                .edge(JobState.INVOICED, JobState.PAID, BILLING)
                // invoice void / correction
                .reasonedEdge(JobState.INVOICED, JobState.COMPLETED, SALES)
                .build();
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private static final Set<Role> CANCELLERS = EnumSet.of(Role.SALES, Role.SYSTEM);

        private final String version;
        private final Map<JobState, Map<JobState, TransitionRule>> edges = new EnumMap<>(JobState.class);

        private Builder(String version) {
            this.version = version;
        }

        public Builder edge(JobState from, JobState to, Set<Role> roles, String... hooks) {
            return add(new TransitionRule(from, to, roles, false, List.of(hooks)));
        }

        public Builder reasonedEdge(JobState from, JobState to, Set<Role> roles, String... hooks) {
            return add(new TransitionRule(from, to, roles, true, List.of(hooks)));
        }

        private Builder add(TransitionRule rule) {
            if (rule.from().isTerminal()) {
                throw new IllegalArgumentException("Terminal state " + rule.from() + " cannot have outgoing edges");
            }
            if (rule.from() == rule.to()) {
                throw new IllegalArgumentException("Self-transition " + rule.from() + " is not a lifecycle edge");
            }
            Map<JobState, TransitionRule> out = edges.computeIfAbsent(rule.from(), k -> new LinkedHashMap<>());
            if (out.putIfAbsent(rule.to(), rule) != null) {
                throw new IllegalArgumentException("Duplicate edge " + rule.from() + " -> " + rule.to());
            }
            return this;
        }

        /** Adds the universal cancellation edge to every non-terminal state that lacks one. */
        public TransitionTable build() {
            for (JobState state : JobState.values()) {
                if (state.isTerminal()) continue;
                edges.computeIfAbsent(state, k -> new LinkedHashMap<>())
                     .putIfAbsent(JobState.CANCELLED,
                             new TransitionRule(state, JobState.CANCELLED, CANCELLERS, false, List.of("notify_client")));
            }
            Map<JobState, Map<JobState, TransitionRule>> frozen = new EnumMap<>(JobState.class);
            edges.forEach((from, out) -> frozen.put(from, Collections.unmodifiableMap(new LinkedHashMap<>(out))));
            return new TransitionTable(version, Collections.unmodifiableMap(frozen));
        }
    }
}
