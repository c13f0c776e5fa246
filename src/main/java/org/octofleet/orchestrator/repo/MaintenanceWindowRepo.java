package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.MaintenanceWindow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MaintenanceWindowRepo extends JpaRepository<MaintenanceWindow, Long> {
    List<MaintenanceWindow> findByEnabledTrue();
    List<MaintenanceWindow> findAllByOrderByNameAsc();
}
