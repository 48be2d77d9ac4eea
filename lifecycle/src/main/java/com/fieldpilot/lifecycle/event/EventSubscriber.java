package com.fieldpilot.lifecycle.event;

/** Receives events on an event-bus lane thread. Exceptions are logged by the bus. */
@FunctionalInterface
public interface EventSubscriber {

    void onEvent(LifecycleEvent event) throws Exception;
}
