package org.octofleet.orchestrator.service.remediation;

import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.domain.VulnerabilityFinding;
import org.octofleet.orchestrator.repo.VulnerabilityFindingRepo;

import java.util.List;
import java.util.Set;

@RequiredArgsConstructor
public class JpaVulnerabilitySource implements VulnerabilitySource {

    private final VulnerabilityFindingRepo repo;

    @Override
    public List<Finding> findings(Set<Severity> severities) {
        var rows = severities == null || severities.isEmpty()
                ? repo.findAllByOrderByIdAsc()
                : repo.findBySeverityInOrderByIdAsc(severities);
        return rows.stream().map(JpaVulnerabilitySource::toFinding).toList();
    }

    static Finding toFinding(VulnerabilityFinding v) {
        return new Finding(v.getNodeId(), v.getCveId(), v.getSoftwareName(), v.getSoftwareVersion(),
                v.getSeverity(), v.getCvssScore());
    }
}
