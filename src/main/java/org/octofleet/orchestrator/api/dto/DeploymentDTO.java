package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.DeploymentStatus;
import org.octofleet.orchestrator.domain.RolloutMode;
import org.octofleet.orchestrator.domain.TargetType;

import java.time.Instant;
import java.util.List;

public record DeploymentDTO(
        String id, String name,
        Long packageId, String packageName, String packageVersion,
        TargetType targetType, String targetId, RolloutMode mode,
        DeploymentStatus status,
        Instant scheduledStart, Instant scheduledEnd, boolean maintenanceWindowOnly,
        String createdBy, Instant createdAt, Instant activatedAt, Instant completedAt,
        Progress progress,
        List<NodeStatusDTO> nodes
) {
    public record Progress(int total, int pending, int inFlight, int success, int failed, int skipped) {}
}
