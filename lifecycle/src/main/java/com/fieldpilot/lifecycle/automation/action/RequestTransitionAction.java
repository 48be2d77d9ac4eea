package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionException;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.model.Actor;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.TransitionSource;
import com.fieldpilot.lifecycle.statemachine.JobStateMachine;
import com.fieldpilot.lifecycle.statemachine.TransitionException;
import com.fieldpilot.lifecycle.statemachine.TransitionResult;
import org.springframework.stereotype.Component;

/**
 * Asks the state machine to move the job to config {@code toState}, as the
 * SYSTEM role. Same validation as any other caller; a rejection is recorded
 * as a failed action.
 */
@Component
public class RequestTransitionAction implements AutomationAction {

    private final JobStateMachine stateMachine;

    public RequestTransitionAction(JobStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public String name() {
        return "request_transition";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        JobState target;
        try {
            target = JobState.parse(ctx.requireConfig("toState"));
        } catch (IllegalArgumentException e) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG, e.getMessage());
        }
        Actor actor = Actor.system("automation:" + ctx.ruleName());
        try {
            TransitionResult result = stateMachine.requestTransition(
                    ctx.jobId(), target, actor, ctx.configString("reason", null), TransitionSource.AUTOMATION);
            return ActionResult.ok("job moved " + result.fromState().wireName() + " -> " + result.state().wireName());
        } catch (TransitionException e) {
            return ActionResult.failed(e.getMessage());
        }
    }
}
