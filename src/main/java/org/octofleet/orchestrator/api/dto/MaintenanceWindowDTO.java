package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.TargetType;

import java.time.LocalTime;
import java.util.List;

public record MaintenanceWindowDTO(
        Long id, String name, List<Integer> daysOfWeek,
        LocalTime startTime, LocalTime endTime, String timezone,
        TargetType targetType, String targetId, boolean enabled
) {}
