package org.octofleet.orchestrator.repo;

import org.octofleet.orchestrator.domain.LiveSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LiveSessionRecordRepo extends JpaRepository<LiveSessionRecord, String> {
}
