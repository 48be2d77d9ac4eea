package com.fieldpilot.lifecycle.automation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates rule conditions against an event payload.
 *
 * All conditions of a rule must hold; an empty list always matches.
 * String comparisons ignore case. Ordering operators compare numerically
 * and are false when either side is not a number. An unknown operator is
 * false (and logged), so a typo in a rule disables it rather than firing it.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    public boolean matchesAll(List<RuleCondition> conditions, Map<String, Object> payload) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        return conditions.stream().allMatch(c -> matches(c, payload));
    }

    public boolean matches(RuleCondition condition, Map<String, Object> payload) {
        Object actual   = resolve(payload, condition.field());
        Object expected = condition.value();
        String operator = condition.operator() == null ? "" : condition.operator().trim().toLowerCase(Locale.ROOT);

        return switch (operator) {
            case "==", "equals"                 -> looselyEqual(actual, expected);
            case "!=", "not_equals"             -> !looselyEqual(actual, expected);
            case ">", "greater_than"            -> compare(actual, expected, c -> c > 0);
            case ">=", "greater_than_or_equals" -> compare(actual, expected, c -> c >= 0);
            case "<", "less_than"               -> compare(actual, expected, c -> c < 0);
            case "<=", "less_than_or_equals"    -> compare(actual, expected, c -> c <= 0);
            case "contains"                     -> contains(actual, expected);
            case "not_contains"                 -> !contains(actual, expected);
            case "starts_with"                  -> text(actual).startsWith(text(expected));
            case "ends_with"                    -> text(actual).endsWith(text(expected));
            case "is_empty"                     -> isEmpty(actual);
            case "is_not_empty"                 -> !isEmpty(actual);
            case "in"                           -> memberOf(actual, expected);
            case "not_in"                       -> !memberOf(actual, expected);
            default -> {
                log.warn("Unknown condition operator '{}' on field '{}'; treating as false",
                        condition.operator(), condition.field());
                yield false;
            }
        };
    }

    // ------------------------------------------------------------------
    // Field resolution
    // ------------------------------------------------------------------

    /** Walks a dotted path ("client.category") through nested maps; null if any hop is missing. */
    static Object resolve(Map<String, Object> payload, String path) {
        if (path == null || path.isBlank()) {
            return payload;
        }
        Object current = payload;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    // ------------------------------------------------------------------
    // Operators
    // ------------------------------------------------------------------

    private static boolean looselyEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == null && expected == null;
        }
        BigDecimal a = number(actual);
        BigDecimal b = number(expected);
        if (a != null && b != null) {
            return a.compareTo(b) == 0;
        }
        return text(actual).equals(text(expected));
    }

    private interface Ordering { boolean test(int cmp); }

    private static boolean compare(Object actual, Object expected, Ordering ordering) {
        BigDecimal a = number(actual);
        BigDecimal b = number(expected);
        return a != null && b != null && ordering.test(a.compareTo(b));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> items) {
            return items.stream().anyMatch(item -> looselyEqual(item, expected));
        }
        return actual != null && text(actual).contains(text(expected));
    }

    private static boolean isEmpty(Object actual) {
        if (actual == null) return true;
        if (actual instanceof Collection<?> c) return c.isEmpty();
        if (actual instanceof Map<?, ?> m) return m.isEmpty();
        return actual.toString().isBlank();
    }

    /** {@code expected} is a list, or a comma-separated string. */
    private static boolean memberOf(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        Collection<?> candidates = expected instanceof Collection<?> c
                ? c
                : Arrays.stream(expected.toString().split(",")).map(String::trim).toList();
        return candidates.stream().filter(Objects::nonNull).anyMatch(v -> looselyEqual(actual, v));
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString().toLowerCase(Locale.ROOT);
    }

    private static BigDecimal number(Object value) {
        if (value instanceof Boolean) {
            return null;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
