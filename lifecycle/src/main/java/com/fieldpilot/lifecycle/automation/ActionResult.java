package com.fieldpilot.lifecycle.automation;

public record ActionResult(boolean success, String detail) {

    public static ActionResult ok(String detail) {
        return new ActionResult(true, detail);
    }

    public static ActionResult failed(String detail) {
        return new ActionResult(false, detail);
    }
}
