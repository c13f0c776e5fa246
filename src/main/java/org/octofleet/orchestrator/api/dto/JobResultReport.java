package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.JobStatus;

public record JobResultReport(
        @NotNull JobStatus status,
        @Nullable Integer exitCode,
        @Nullable String output,
        @Nullable @Size(max = 2000) String errorMessage
) {}
