package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.SessionKind;
import org.octofleet.orchestrator.domain.SessionState;

public record StartSessionDTO(String sessionId, String nodeId, SessionKind kind, SessionState state, boolean reused) {}
