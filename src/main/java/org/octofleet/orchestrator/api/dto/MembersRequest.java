package org.octofleet.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record MembersRequest(@NotNull List<String> nodeIds) {}
