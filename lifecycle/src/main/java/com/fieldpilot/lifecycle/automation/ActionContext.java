package com.fieldpilot.lifecycle.automation;

import com.fieldpilot.lifecycle.event.LifecycleEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Everything an action sees: the triggering event, the rule that fired and
 * the action's own config block from the rule definition.
 */
public record ActionContext(
        LifecycleEvent      event,
        UUID                ruleId,
        String              ruleName,
        Map<String, Object> config) {

    public ActionContext {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    public UUID jobId() {
        return event.jobId();
    }

    /** String value from the event payload, or null. */
    public String payloadString(String key) {
        Object v = event.payload().get(key);
        return v == null ? null : v.toString();
    }

    public String configString(String key, String fallback) {
        Object v = config.get(key);
        return v == null || v.toString().isBlank() ? fallback : v.toString();
    }

    /** @throws ActionException INVALID_CONFIG when the key is missing or blank */
    public String requireConfig(String key) {
        String v = configString(key, null);
        if (v == null) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG,
                    "config '" + key + "' is required");
        }
        return v;
    }
}
