package com.fieldpilot.lifecycle.automation;

/**
 * An automation action could not do its work.
 *
 * Caught by the automation engine and recorded on the run; never reaches
 * the event bus or the caller whose transition triggered the rule.
 */
public class ActionException extends RuntimeException {

    public enum Kind { UNKNOWN_ACTION, INVALID_CONFIG, NOT_FOUND, GATEWAY_ERROR }

    private final Kind kind;

    public ActionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ActionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
