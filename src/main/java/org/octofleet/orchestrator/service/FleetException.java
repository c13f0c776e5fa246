package org.octofleet.orchestrator.service;

import org.octofleet.orchestrator.api.error.ErrorCode;

import java.util.Map;

/**
 * Base of the synchronous error taxonomy. Thrown only from command handlers, before any
 * state is mutated; asynchronous failures are recorded on the entity instead.
 */
public abstract class FleetException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> details;

    protected FleetException(ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = details == null ? Map.of() : details;
    }

    public ErrorCode code() { return code; }
    public Map<String, Object> details() { return details; }
}
