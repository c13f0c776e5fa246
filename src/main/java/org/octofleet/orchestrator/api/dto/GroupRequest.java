package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.octofleet.orchestrator.service.group.GroupRule;

import java.util.List;

public record GroupRequest(
        @NotBlank @Size(max = 128) String name,
        @Nullable @Size(max = 512) String description,
        boolean dynamic,
        @Nullable GroupRule rule,
        @Nullable List<@NotBlank String> members
) {}
