package com.fieldpilot.lifecycle.automation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final Map<String, Object> payload = Map.of(
            "toState", "completed",
            "fromState", "in_progress",
            "actorRole", "crew",
            "hooks", List.of("create_invoice"),
            "amount", 1250.5,
            "client", Map.of("category", "POTENTIAL", "visits", "3"));

    @Test
    void emptyConditionList_alwaysMatches() {
        assertThat(evaluator.matchesAll(List.of(), payload)).isTrue();
        assertThat(evaluator.matchesAll(null, payload)).isTrue();
    }

    @Test
    void equals_ignoresCaseAndAcceptsSymbolAlias() {
        assertThat(evaluator.matches(cond("toState", "equals", "COMPLETED"), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState", "==", "completed"), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState", "!=", "cancelled"), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState", "not_equals", "completed"), payload)).isFalse();
    }

    @Test
    void numbers_compareByValue() {
        assertThat(evaluator.matches(cond("amount", ">", 1000), payload)).isTrue();
        assertThat(evaluator.matches(cond("amount", "<=", "1250.50"), payload)).isTrue();
        assertThat(evaluator.matches(cond("amount", "==", "1250.500"), payload)).isTrue();
        assertThat(evaluator.matches(cond("client.visits", ">=", 3), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState", ">", 1), payload)).isFalse();
    }

    @Test
    void dottedPath_walksNestedMaps() {
        assertThat(evaluator.matches(cond("client.category", "equals", "potential"), payload)).isTrue();
        assertThat(evaluator.matches(cond("client.missing.deeper", "is_empty", null), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState.nested", "equals", "x"), payload)).isFalse();
    }

    @Test
    void contains_worksOnListsAndStrings() {
        assertThat(evaluator.matches(cond("hooks", "contains", "create_invoice"), payload)).isTrue();
        assertThat(evaluator.matches(cond("hooks", "not_contains", "notify_crew"), payload)).isTrue();
        assertThat(evaluator.matches(cond("fromState", "contains", "PROG"), payload)).isTrue();
        assertThat(evaluator.matches(cond("fromState", "starts_with", "in_"), payload)).isTrue();
        assertThat(evaluator.matches(cond("fromState", "ends_with", "draft"), payload)).isFalse();
    }

    @Test
    void membership_acceptsListOrCommaSeparatedString() {
        assertThat(evaluator.matches(cond("toState", "in", List.of("paid", "completed")), payload)).isTrue();
        assertThat(evaluator.matches(cond("toState", "in", "paid, completed"), payload)).isTrue();
        assertThat(evaluator.matches(cond("actorRole", "not_in", "sales,system"), payload)).isTrue();
        assertThat(evaluator.matches(cond("missing", "in", "a,b"), payload)).isFalse();
    }

    @Test
    void emptiness() {
        assertThat(evaluator.matches(cond("hooks", "is_not_empty", null), payload)).isTrue();
        assertThat(evaluator.matches(cond("reason", "is_empty", null), payload)).isTrue();
    }

    @Test
    void unknownOperator_isFalse() {
        assertThat(evaluator.matches(cond("toState", "resembles", "completed"), payload)).isFalse();
        assertThat(evaluator.matchesAll(List.of(
                cond("toState", "equals", "completed"),
                cond("toState", "resembles", "completed")), payload)).isFalse();
    }

    private static RuleCondition cond(String field, String operator, Object value) {
        return new RuleCondition(field, operator, value);
    }
}
