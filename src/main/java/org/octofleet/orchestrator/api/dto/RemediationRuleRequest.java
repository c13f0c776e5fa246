package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.Severity;

public record RemediationRuleRequest(
        @NotBlank @Size(max = 128) String name,
        @NotNull Severity minSeverity,
        @Nullable @Size(max = 256) String softwarePattern,
        boolean autoRemediate,
        @Nullable Boolean requireApproval,
        boolean maintenanceWindowOnly,
        @Nullable Boolean enabled
) {}
