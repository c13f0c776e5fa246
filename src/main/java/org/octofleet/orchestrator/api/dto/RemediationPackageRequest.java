package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.FixMethod;

public record RemediationPackageRequest(
        @NotBlank @Size(max = 128) String name,
        @Nullable @Size(max = 512) String description,
        @NotBlank @Size(max = 256) String targetSoftware,
        @Nullable @Size(max = 64) String minFixedVersion,
        @NotNull FixMethod fixMethod,
        @Nullable @Size(max = 2000) String fixCommand,
        @Nullable @Size(max = 2000) String rollbackCommand,
        @Nullable Long packageId,
        @Nullable Boolean enabled
) {}
