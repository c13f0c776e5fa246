package org.octofleet.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;

public record ActivePatch(@NotNull Boolean active) {}
