package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.NodeRolloutStatus;

/**
 * Agent callback: downloading, installing, success or failed.
 *
 * @param attempt the {@code attempt} of the install command being reported on
 */
public record NodeResultReport(
        @NotNull NodeRolloutStatus status,
        @NotNull @Min(0) Integer attempt,
        @Nullable Integer exitCode,
        @Nullable @Size(max = 2000) String errorMessage,
        @Nullable String output
) {}
