package org.octofleet.orchestrator.repo;

import jakarta.persistence.LockModeType;
import org.octofleet.orchestrator.domain.Node;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NodeRepo extends JpaRepository<Node, Long> {
    Optional<Node> findByNodeId(String nodeId);
    boolean existsByNodeId(String nodeId);
    List<Node> findAllByOrderByHostnameAsc();
    List<Node> findByNodeIdIn(Collection<String> nodeIds);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select n from Node n where n.nodeId = :nodeId")
    Optional<Node> findForUpdate(@Param("nodeId") String nodeId);

    /** candidates for the offline flip; each one is re-checked under its row lock */
    @Query("select n.nodeId from Node n where n.online = true and (n.lastSeen is null or n.lastSeen < :cutoff)")
    List<String> findStaleOnline(@Param("cutoff") Instant cutoff);
}
