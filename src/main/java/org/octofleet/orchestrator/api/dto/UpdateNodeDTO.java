package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Size;

import java.util.List;

public record UpdateNodeDTO(
        @Nullable @Size(max = 20) List<@Size(min = 1, max = 32) String> tags
) {}
