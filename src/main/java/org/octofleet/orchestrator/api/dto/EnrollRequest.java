package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record EnrollRequest(
        @NotBlank @Size(max = 128) String nodeId,
        @NotBlank @Size(max = 128) String hostname,
        @Nullable @Size(max = 128) String osName,
        @Nullable @Size(max = 64) String osVersion,
        @Nullable @Size(max = 64) String osBuild,
        @Nullable @Size(max = 64) String agentVersion,
        @Nullable @Size(max = 128) String domain,
        @Nullable @Size(max = 20) List<@Size(min = 1, max = 32) String> tags
) {}
