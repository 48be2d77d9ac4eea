package com.fieldpilot.lifecycle.statemachine;

import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.Role;

import java.util.List;
import java.util.Set;

/**
 * One legal edge of the job lifecycle graph.
 *
 * @param from           state the job must currently be in
 * @param to             requested state
 * @param roles          roles allowed to take this edge; ADMIN is always allowed
 * @param reasonRequired true when the caller must say why (weather hold, invoice void)
 * @param hooks          side-effect hook names carried on the job_transitioned event
 */
public record TransitionRule(
        JobState     from,
        JobState     to,
        Set<Role>    roles,
        boolean      reasonRequired,
        List<String> hooks) {

    public TransitionRule {
        roles = Set.copyOf(roles);
        hooks = List.copyOf(hooks);
    }

    public boolean permits(Role role) {
        return role == Role.ADMIN || roles.contains(role);
    }
}
