package com.fieldpilot.lifecycle.model;

import java.util.Objects;

/**
 * Who is asking for a transition. Identity and role come from the
 * (external) authentication layer; this service only checks the role.
 */
public record Actor(String id, Role role) {

    public Actor {
        Objects.requireNonNull(id, "actor id");
        Objects.requireNonNull(role, "actor role");
    }

    public static Actor system(String name) {
        return new Actor("system:" + name, Role.SYSTEM);
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }
}
