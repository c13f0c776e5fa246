package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.SoftwarePackage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SoftwarePackageRepo extends JpaRepository<SoftwarePackage, Long> {
    Optional<SoftwarePackage> findByNameIgnoreCaseAndVersion(String name, String version);
    List<SoftwarePackage> findAllByOrderByNameAscVersionAsc();
}
