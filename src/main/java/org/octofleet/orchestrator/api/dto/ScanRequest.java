package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import org.octofleet.orchestrator.domain.Severity;

import java.util.List;

public record ScanRequest(@Nullable List<Severity> severityFilter, boolean dryRun) {}
