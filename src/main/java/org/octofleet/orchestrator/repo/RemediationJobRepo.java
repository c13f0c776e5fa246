package org.octofleet.orchestrator.repo;

import jakarta.persistence.LockModeType;
import org.octofleet.orchestrator.domain.JobStatus;
import org.octofleet.orchestrator.domain.RemediationJob;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RemediationJobRepo extends JpaRepository<RemediationJob, Long> {
    Page<RemediationJob> findAllByOrderByCreatedAtDesc(Pageable pageable);
    Page<RemediationJob> findByStatusOrderByCreatedAtDesc(JobStatus status, Pageable pageable);
    Page<RemediationJob> findByNodeIdOrderByCreatedAtDesc(String nodeId, Pageable pageable);

    boolean existsByNodeIdAndCveIdAndStatusIn(String nodeId, String cveId, Collection<JobStatus> statuses);
    boolean existsByNodeIdAndCveIdAndStatusInAndIdNot(String nodeId, String cveId, Collection<JobStatus> statuses, Long id);

    long countByStatus(JobStatus status);
    boolean existsByRemediationPackageId(Long packageId);
    boolean existsByRuleId(Long ruleId);

    @Query("select j.id from RemediationJob j where j.status = :status and j.rule.autoRemediate = true order by j.id")
    List<Long> findAutoRemediateIds(@Param("status") JobStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from RemediationJob j where j.id = :id")
    Optional<RemediationJob> findForUpdate(@Param("id") Long id);
}
