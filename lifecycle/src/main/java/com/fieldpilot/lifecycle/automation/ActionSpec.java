package com.fieldpilot.lifecycle.automation;

import java.util.Map;

/** One action of a rule definition: registry name plus its config block. */
public record ActionSpec(String name, Map<String, Object> config) {

    public ActionSpec {
        config = config == null ? Map.of() : config;
    }
}
