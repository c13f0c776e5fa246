package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.FixMethod;
import org.octofleet.orchestrator.domain.JobStatus;
import org.octofleet.orchestrator.domain.Severity;

import java.time.Instant;

public record RemediationJobDTO(
        Long id, String nodeId, String cveId,
        String softwareName, String softwareVersion, Severity severity,
        Long remediationPackageId, String packageName, FixMethod fixMethod,
        Long ruleId, JobStatus status, boolean requiresApproval,
        String approvedBy, Instant approvedAt,
        int attempts, String reasonCode,
        Integer exitCode, String errorMessage, String output,
        Instant createdAt, Instant startedAt, Instant completedAt
) {}
