package com.fieldpilot.lifecycle.automation;

/**
 * A named side effect a rule can trigger (create invoice, change client
 * category, notify, request a transition).
 *
 * Implementations are Spring {@code @Component}s and are collected by
 * {@link ActionRegistry} at startup. An action may fail by returning
 * {@link ActionResult#failed} or by throwing; either way the engine records
 * the failure and moves on to the next action of the rule.
 *
 * Actions must not change a job's state directly. The only path is the
 * state machine engine, acting as the SYSTEM role.
 */
public interface AutomationAction {

    /** Registry key used in rule definitions, e.g. "create_draft_invoice". */
    String name();

    ActionResult execute(ActionContext ctx) throws ActionException;
}
