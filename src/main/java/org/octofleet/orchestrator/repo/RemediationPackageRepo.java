package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.RemediationPackage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RemediationPackageRepo extends JpaRepository<RemediationPackage, Long> {
    List<RemediationPackage> findByEnabledTrueOrderByIdAsc();
    List<RemediationPackage> findAllByOrderByNameAsc();
    long countByEnabledTrue();
}
