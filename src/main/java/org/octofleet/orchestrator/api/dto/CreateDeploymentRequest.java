package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.RolloutMode;
import org.octofleet.orchestrator.domain.TargetType;

import java.time.Instant;

public record CreateDeploymentRequest(
        @NotBlank @Size(max = 256) String name,
        @NotBlank @Size(max = 128) String packageName,
        @NotBlank @Size(max = 64) String packageVersion,
        @NotNull TargetType targetType,
        @Nullable @Size(max = 128) String targetId,
        @Nullable RolloutMode mode,
        @Nullable Instant scheduledStart,
        @Nullable Instant scheduledEnd,
        boolean maintenanceWindowOnly
) {}
