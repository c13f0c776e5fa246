package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.SessionKind;
import org.octofleet.orchestrator.domain.SessionState;

import java.time.Instant;
import java.util.Map;

public record LiveSessionDTO(
        String id, String nodeId, SessionKind kind, SessionState state,
        String reason, String requestedBy, Map<String, Object> options,
        int subscribers, long droppedFrames,
        Instant createdAt, Instant activatedAt, Instant closedAt
) {}
