package com.fieldpilot.lifecycle.api.dto;

import com.fieldpilot.lifecycle.automation.ActionSpec;
import com.fieldpilot.lifecycle.automation.RuleCondition;
import com.fieldpilot.lifecycle.model.AutomationRule;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RuleResponse(
        UUID                id,
        String              name,
        String              description,
        String              triggerEvent,
        List<RuleCondition> conditions,
        List<ActionSpec>    actions,
        boolean             enabled,
        int                 maxFirings,
        int                 windowMinutes,
        int                 priority,
        Instant             updatedAt
) {
    public static RuleResponse from(AutomationRule rule, List<RuleCondition> conditions, List<ActionSpec> actions) {
        return new RuleResponse(rule.getId(), rule.getName(), rule.getDescription(), rule.getTriggerEvent(),
                conditions, actions, rule.isEnabled(), rule.getMaxFirings(), rule.getWindowMinutes(),
                rule.getPriority(), rule.getUpdatedAt());
    }
}
