package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.NodeGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface NodeGroupRepo extends JpaRepository<NodeGroup, Long> {
    Optional<NodeGroup> findByNameIgnoreCase(String name);
    List<NodeGroup> findAllByOrderByNameAsc();
}
