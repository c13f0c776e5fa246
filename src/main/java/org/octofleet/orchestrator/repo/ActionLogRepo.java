package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.ActionLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActionLogRepo extends JpaRepository<ActionLog, Long> {
    Page<ActionLog> findAllByOrderByTsDesc(Pageable pageable);
    Page<ActionLog> findByTargetTypeAndTargetIdOrderByTsDesc(String targetType, String targetId, Pageable pageable);
}
