package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.RemediationRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RemediationRuleRepo extends JpaRepository<RemediationRule, Long> {
    List<RemediationRule> findByEnabledTrueOrderByIdAsc();
    List<RemediationRule> findAllByOrderByIdAsc();
    long countByEnabledTrue();
}
