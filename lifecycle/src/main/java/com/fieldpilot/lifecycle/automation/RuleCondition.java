package com.fieldpilot.lifecycle.automation;

/**
 * One predicate of a rule: {@code field} is a dotted path into the event
 * payload, {@code value} is a string, number, boolean or list.
 */
public record RuleCondition(String field, String operator, Object value) {}
