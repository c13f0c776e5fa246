package org.octofleet.orchestrator.service;

import org.octofleet.orchestrator.api.error.ErrorCode;

import java.util.Map;

public class ConflictException extends FleetException {
    public ConflictException(ErrorCode code, String message) {
        super(code, message, Map.of());
    }

    public ConflictException(ErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details);
    }

    public static ConflictException illegalTransition(String entity, Object id, Object from, Object to) {
        return new ConflictException(ErrorCode.ILLEGAL_TRANSITION,
                "%s %s cannot go from %s to %s".formatted(entity, id, from, to),
                Map.of("from", String.valueOf(from), "to", String.valueOf(to)));
    }
}
