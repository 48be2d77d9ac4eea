package com.fieldpilot.lifecycle.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldpilot.lifecycle.model.AutomationRule;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON (de)serialization of rule conditions, rule actions and run results.
 * The columns stay plain text so the schema runs on both Postgres and H2.
 */
@Component
public class RuleDefinitionCodec {

    private static final TypeReference<List<RuleCondition>> CONDITIONS = new TypeReference<>() {};
    private static final TypeReference<List<ActionSpec>>    ACTIONS    = new TypeReference<>() {};
    private static final TypeReference<List<ActionOutcome>> OUTCOMES   = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RuleDefinitionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** @throws IllegalArgumentException if the stored JSON is malformed */
    public List<RuleCondition> conditions(AutomationRule rule) {
        return read(rule.getConditionsJson(), CONDITIONS, "conditions of rule " + rule.getName());
    }

    /** @throws IllegalArgumentException if the stored JSON is malformed */
    public List<ActionSpec> actions(AutomationRule rule) {
        return read(rule.getActionsJson(), ACTIONS, "actions of rule " + rule.getName());
    }

    public List<ActionOutcome> outcomes(String json) {
        return read(json, OUTCOMES, "action results");
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type, String what) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> parsed = mapper.readValue(json, type);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
