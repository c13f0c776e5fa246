package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.TargetType;

import java.time.LocalTime;
import java.util.List;

public record MaintenanceWindowRequest(
        @NotBlank @Size(max = 128) String name,
        @Nullable List<@NotNull @Min(0) @Max(6) Integer> daysOfWeek,
        @NotNull LocalTime startTime,
        @NotNull LocalTime endTime,
        @Nullable @Size(max = 64) String timezone,
        @Nullable TargetType targetType,
        @Nullable @Size(max = 128) String targetId,
        @Nullable Boolean enabled
) {}
