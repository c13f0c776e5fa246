package org.octofleet.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record FramesPush(@NotNull List<Map<String, Object>> frames) {}
