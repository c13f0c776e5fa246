package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.domain.VulnerabilityFinding;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface VulnerabilityFindingRepo extends JpaRepository<VulnerabilityFinding, Long> {
    List<VulnerabilityFinding> findBySeverityInOrderByIdAsc(Collection<Severity> severities);
    List<VulnerabilityFinding> findAllByOrderByIdAsc();
    Optional<VulnerabilityFinding> findByNodeIdAndCveIdAndSoftwareNameIgnoreCase(String nodeId, String cveId, String softwareName);
}
