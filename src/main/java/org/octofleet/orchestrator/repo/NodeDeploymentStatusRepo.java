package org.octofleet.orchestrator.repo;

import jakarta.persistence.LockModeType;
import org.octofleet.orchestrator.domain.NodeDeploymentStatus;
import org.octofleet.orchestrator.domain.NodeRolloutStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NodeDeploymentStatusRepo extends JpaRepository<NodeDeploymentStatus, Long> {

    @Query("select s from NodeDeploymentStatus s where s.deployment.id = :deploymentId order by s.nodeId")
    List<NodeDeploymentStatus> findByDeployment(@Param("deploymentId") String deploymentId);

    @Query("select s.nodeId from NodeDeploymentStatus s where s.deployment.id = :deploymentId and s.status = :status")
    List<String> findNodeIds(@Param("deploymentId") String deploymentId,
                             @Param("status") NodeRolloutStatus status);

    @Query("select count(s) from NodeDeploymentStatus s where s.deployment.id = :deploymentId and s.status not in :terminal")
    long countNotIn(@Param("deploymentId") String deploymentId,
                    @Param("terminal") Collection<NodeRolloutStatus> terminal);

    @Query("select s.nodeId from NodeDeploymentStatus s where s.deployment.id = :deploymentId " +
            "and s.status in :statuses and s.lastAttemptAt < :before")
    List<String> findNodeIdsAttemptedBefore(@Param("deploymentId") String deploymentId,
                                            @Param("statuses") Collection<NodeRolloutStatus> statuses,
                                            @Param("before") Instant before);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from NodeDeploymentStatus s where s.deployment.id = :deploymentId and s.nodeId = :nodeId")
    Optional<NodeDeploymentStatus> findForUpdate(@Param("deploymentId") String deploymentId,
                                                 @Param("nodeId") String nodeId);
}
