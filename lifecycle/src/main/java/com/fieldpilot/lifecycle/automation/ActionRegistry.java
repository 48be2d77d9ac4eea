package com.fieldpilot.lifecycle.automation;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name → {@link AutomationAction} lookup, filled from every action bean at
 * startup. Adding an action only requires declaring it as {@code @Component}.
 */
@Component
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, AutomationAction> actions = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ActionRegistry(List<AutomationAction> allActions, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (AutomationAction action : allActions) {
            if (actions.putIfAbsent(action.name(), action) != null) {
                throw new IllegalStateException("Duplicate automation action name: " + action.name());
            }
            log.info("Registered automation action '{}'", action.name());
        }
    }

    public AutomationAction get(String name) {
        AutomationAction action = actions.get(name);
        if (action == null) {
            throw new ActionException(ActionException.Kind.UNKNOWN_ACTION, "No action named '" + name + "'");
        }
        return action;
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    public List<String> actionNames() {
        return actions.keySet().stream().sorted().toList();
    }

    /**
     * Run a named action, timed and counted:
     * <pre>
     *   fieldpilot.automation.action.calls{action, status="success|failed|error"}
     *   fieldpilot.automation.action.duration{action}
     * </pre>
     *
     * @throws ActionException for unknown names and for any exception the action throws
     */
    public ActionResult execute(String name, ActionContext ctx) {
        AutomationAction action = get(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            ActionResult result = action.execute(ctx);
            if (result == null) {
                throw new ActionException(ActionException.Kind.GATEWAY_ERROR, "action '" + name + "' returned no result");
            }
            status = result.success() ? "success" : "failed";
            return result;
        } catch (ActionException e) {
            throw e;
        } catch (Exception e) {
            throw new ActionException(ActionException.Kind.GATEWAY_ERROR,
                    "Unexpected error in action '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("fieldpilot.automation.action.duration", "action", name));
            meterRegistry.counter("fieldpilot.automation.action.calls",
                    "action", name, "status", status).increment();
        }
    }
}
