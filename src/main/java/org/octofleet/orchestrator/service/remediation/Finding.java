package org.octofleet.orchestrator.service.remediation;

import org.octofleet.orchestrator.domain.Severity;

public record Finding(String nodeId, String cveId, String softwareName, String softwareVersion,
                      Severity severity, Double cvssScore) {
}
