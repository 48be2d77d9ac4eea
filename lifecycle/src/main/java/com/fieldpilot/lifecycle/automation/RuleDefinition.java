package com.fieldpilot.lifecycle.automation;

import java.util.List;

/** Editable part of an automation rule. Null numeric fields keep their defaults. */
public record RuleDefinition(
        String              name,
        String              description,
        String              triggerEvent,
        List<RuleCondition> conditions,
        List<ActionSpec>    actions,
        Boolean             enabled,
        Integer             maxFirings,
        Integer             windowMinutes,
        Integer             priority) {

    public RuleDefinition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions    = actions == null ? List.of() : List.copyOf(actions);
    }
}
