package org.octofleet.orchestrator.service.remediation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.FindingIngest;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.domain.VulnerabilityFinding;
import org.octofleet.orchestrator.repo.VulnerabilityFindingRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class FindingIngestService {

    private final VulnerabilityFindingRepo repo;
    private final Clock clock;

    @Transactional
    public int ingest(FindingIngest body) {
        var now = clock.instant();
        int n = 0;
        for (var i : body.findings()) {
            var cve = i.cveId().trim().toUpperCase(Locale.ROOT);
            var nodeId = i.nodeId().trim();
            var software = i.softwareName().trim();
            var row = repo.findByNodeIdAndCveIdAndSoftwareNameIgnoreCase(nodeId, cve, software)
                    .orElseGet(() -> VulnerabilityFinding.builder()
                            .nodeId(nodeId).cveId(cve).softwareName(software)
                            .build());
            row.setSoftwareVersion(i.softwareVersion());
            row.setSeverity(i.severity());
            row.setCvssScore(i.cvssScore());
            row.setDetectedAt(now);
            repo.save(row);
            n++;
        }
        log.debug("ingested {} finding(s)", n);
        return n;
    }

    @Transactional(readOnly = true)
    public List<Finding> list(Set<Severity> severities) {
        var rows = severities == null || severities.isEmpty()
                ? repo.findAllByOrderByIdAsc()
                : repo.findBySeverityInOrderByIdAsc(severities);
        return rows.stream().map(JpaVulnerabilitySource::toFinding).toList();
    }
}
