package org.octofleet.orchestrator.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ApproveRequest(@NotEmpty List<@NotNull Long> jobIds) {}
