package org.octofleet.orchestrator.service;

import org.octofleet.orchestrator.api.error.ErrorCode;

import java.util.Map;

public class UpstreamUnavailableException extends FleetException {
    public UpstreamUnavailableException(ErrorCode code, String message) {
        super(code, message, Map.of());
    }

    public static UpstreamUnavailableException nodeOffline(String nodeId) {
        return new UpstreamUnavailableException(ErrorCode.NODE_OFFLINE, "node has no live agent channel: " + nodeId);
    }
}
