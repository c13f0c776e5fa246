package org.octofleet.orchestrator.api.dto;

import java.util.List;
import java.util.Map;

public record RemediationSummaryDTO(
        Map<String, Long> jobCounts,
        List<RemediationJobDTO> recentJobs,
        long activePackages,
        long activeRules,
        long fixableVulnerabilities,
        boolean inMaintenanceWindow
) {}
