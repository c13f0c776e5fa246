package org.octofleet.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;
import org.octofleet.orchestrator.domain.DeploymentStatus;

public record DeploymentPatch(@NotNull DeploymentStatus status) {}
