package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.domain.Severity;

import java.util.List;

public record FindingIngest(@NotEmpty @Size(max = 5000) List<@Valid Item> findings) {
    public record Item(
            @NotBlank @Size(max = 128) String nodeId,
            @NotBlank @Size(max = 64) String cveId,
            @NotBlank @Size(max = 256) String softwareName,
            @Nullable @Size(max = 64) String softwareVersion,
            @NotNull Severity severity,
            @Nullable Double cvssScore
    ) {}
}
