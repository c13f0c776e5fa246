package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.Severity;

import java.time.Instant;

public record RemediationRuleDTO(
        Long id, String name, Severity minSeverity, String softwarePattern,
        boolean autoRemediate, boolean requireApproval, boolean maintenanceWindowOnly,
        boolean enabled, Instant createdAt
) {}
