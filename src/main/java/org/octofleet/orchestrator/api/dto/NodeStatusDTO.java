package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.NodeRolloutStatus;

import java.time.Instant;

public record NodeStatusDTO(
        String deploymentId, String nodeId,
        NodeRolloutStatus status, int attempts,
        Instant startedAt, Instant completedAt, Instant lastAttemptAt,
        Integer exitCode, String errorMessage, String output
) {}
