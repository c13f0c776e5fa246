package org.octofleet.orchestrator.repo;

import jakarta.persistence.LockModeType;
import org.octofleet.orchestrator.domain.Deployment;
import org.octofleet.orchestrator.domain.DeploymentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DeploymentRepo extends JpaRepository<Deployment, String> {
    Page<Deployment> findAllByOrderByCreatedAtDesc(Pageable pageable);
    Page<Deployment> findByStatusOrderByCreatedAtDesc(DeploymentStatus status, Pageable pageable);

    @Query("select d.id from Deployment d where d.status = :status")
    List<String> findIdsByStatus(@Param("status") DeploymentStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Deployment d where d.id = :id")
    Optional<Deployment> findForUpdate(@Param("id") String id);
}
