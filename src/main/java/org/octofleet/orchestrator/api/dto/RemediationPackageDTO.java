package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.FixMethod;

import java.time.Instant;

public record RemediationPackageDTO(
        Long id, String name, String description,
        String targetSoftware, String minFixedVersion,
        FixMethod fixMethod, String fixCommand, String rollbackCommand,
        Long packageId, boolean enabled, Instant createdAt
) {}
