package org.octofleet.orchestrator.service;

import org.octofleet.orchestrator.api.error.ErrorCode;

import java.util.Map;

public class NotFoundException extends FleetException {
    public NotFoundException(String what, Object id) {
        super(ErrorCode.NOT_FOUND, what + " not found: " + id, Map.of("id", String.valueOf(id)));
    }
}
