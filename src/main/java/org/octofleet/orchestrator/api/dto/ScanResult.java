package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.domain.Severity;

import java.util.List;

public record ScanResult(
        int scanned,
        int withFixAvailable,
        int jobsCreated,
        int jobsSkippedExisting,
        int jobsSkippedNoRule,
        List<Detail> details
) {
    /** outcome: created, would_create, existing, no_rule */
    public record Detail(String nodeId, String cveId, String softwareName, String softwareVersion,
                         Severity severity, Long packageId, String packageName, Long ruleId,
                         Boolean requiresApproval, String outcome) {}
}
