package org.octofleet.orchestrator.api.dto;

import java.time.Instant;

public record ActionLogDTO(Long id, String userIp, String actor, String action,
                           String targetType, String targetId, String details, Instant ts) {}
