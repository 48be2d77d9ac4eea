package com.fieldpilot.lifecycle.statemachine;

import java.util.List;
import java.util.UUID;

/**
 * A transition request was rejected. The job is unchanged.
 *
 * Unchecked so the API layer maps it in one place; only
 * {@link Kind#CONCURRENT_MODIFICATION} is worth retrying.
 */
public class TransitionException extends RuntimeException {

    public enum Kind { JOB_NOT_FOUND, INVALID_TRANSITION, FORBIDDEN, PRECONDITION_FAILED, CONCURRENT_MODIFICATION }

    private final Kind         kind;
    private final UUID         jobId;
    private final List<String> details;

    public TransitionException(Kind kind, UUID jobId, String message) {
        this(kind, jobId, message, List.of(), null);
    }

    public TransitionException(Kind kind, UUID jobId, String message, List<String> details) {
        this(kind, jobId, message, details, null);
    }

    public TransitionException(Kind kind, UUID jobId, String message, List<String> details, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind    = kind;
        this.jobId   = jobId;
        this.details = List.copyOf(details);
    }

    public Kind         getKind()    { return kind; }
    public UUID         getJobId()   { return jobId; }
    public List<String> getDetails() { return details; }

    public boolean isRetryable() {
        return kind == Kind.CONCURRENT_MODIFICATION;
    }
}
