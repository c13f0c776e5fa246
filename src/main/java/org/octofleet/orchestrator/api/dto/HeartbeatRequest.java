package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.Size;

public record HeartbeatRequest(@Nullable @Size(max = 64) String agentVersion) {}
