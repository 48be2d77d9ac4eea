package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.automation.ActionSpec;
import com.fieldpilot.lifecycle.automation.RuleCondition;
import com.fieldpilot.lifecycle.automation.RuleDefinition;

import java.util.List;

/**
 * Request body for POST/PUT /automation/rules.
 *
 * Example:
 * <pre>
 *   {"name":"Invoice on completion","triggerEvent":"job_transitioned",
 *    "conditions":[{"field":"toState","operator":"equals","value":"completed"}],
 *    "actions":[{"name":"create_draft_invoice","config":{}}]}
 * </pre>
 */
public record RuleRequest(String name, String description, String triggerEvent,
                          List<RuleCondition> conditions, List<ActionSpec> actions,
                          Boolean enabled, Integer maxFirings, Integer windowMinutes, Integer priority) {

    public RuleDefinition toDefinition() {
        return new RuleDefinition(name, description, triggerEvent, conditions, actions,
                enabled, maxFirings, windowMinutes, priority);
    }
}
