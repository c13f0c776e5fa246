package org.octofleet.orchestrator.service.remediation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.api.dto.EnrollRequest;
import org.octofleet.orchestrator.api.dto.FindingIngest;
import org.octofleet.orchestrator.api.dto.JobResultReport;
import org.octofleet.orchestrator.api.dto.RemediationJobDTO;
import org.octofleet.orchestrator.api.dto.RemediationPackageRequest;
import org.octofleet.orchestrator.api.dto.RemediationRuleRequest;
import org.octofleet.orchestrator.api.dto.ScanResult;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.FixMethod;
import org.octofleet.orchestrator.domain.JobStatus;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.repo.RemediationJobRepo;
import org.octofleet.orchestrator.service.ConflictException;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.agent.AgentCommand;
import org.octofleet.orchestrator.service.agent.PollingAgentGateway;
import org.octofleet.orchestrator.service.registry.NodeRegistryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Each test rolls back, so scans only ever see the findings seeded here. */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class RemediationPipelineTest {

    @Autowired RemediationPipeline pipeline;
    @Autowired RemediationCatalogService catalog;
    @Autowired FindingIngestService findings;
    @Autowired NodeRegistryService registry;
    @Autowired PollingAgentGateway gateway;
    @Autowired RemediationJobRepo jobs;

    @BeforeEach
    void seed() {
        registry.enroll(new EnrollRequest("rem-ws1", "REM-WS1", "Windows 11 Pro", "23H2", null, "0.4.2", null, List.of()));

        catalog.createPackage(new RemediationPackageRequest("7-Zip upgrade", null, "7-Zip", "23.01",
                FixMethod.WINGET, null, null, null, true));
        catalog.createPackage(new RemediationPackageRequest("Chrome upgrade", null, "Google Chrome", "126.0",
                FixMethod.SCRIPT, "choco upgrade googlechrome -y", "choco install googlechrome --version 125.0 -y", null, true));
        catalog.createRule(new RemediationRuleRequest("high and up", Severity.HIGH, null,
                false, true, false, true));

        findings.ingest(new FindingIngest(List.of(
                item("rem-ws1", "CVE-2024-1001", "7-Zip", "19.00", Severity.HIGH),
                item("rem-ws2", "CVE-2024-1001", "7-Zip", "22.01", Severity.HIGH),
                item("rem-ws1", "CVE-2024-1002", "Google Chrome", "125.0.6422.60", Severity.CRITICAL),
                item("rem-ws2", "CVE-2024-1003", "7-Zip", "23.01", Severity.HIGH),
                item("rem-ws2", "CVE-2024-1004", "Notepad++", "8.1", Severity.HIGH))));
    }

    private static FindingIngest.Item item(String node, String cve, String software, String version, Severity sev) {
        return new FindingIngest.Item(node, cve, software, version, sev, null);
    }

    private RemediationJobDTO job(String nodeId, String cve) {
        return pipeline.list(null, nodeId, 100, 0).stream()
                .filter(j -> j.cveId().equals(cve)).findFirst().orElseThrow();
    }

    @Test
    void dryRunReportsWithoutPersisting() {
        ScanResult r = pipeline.scan(List.of(), true);

        assertThat(r.scanned()).isEqualTo(5);
        assertThat(r.withFixAvailable()).isEqualTo(3);
        assertThat(r.jobsCreated()).isZero();
        assertThat(r.jobsSkippedExisting()).isZero();
        assertThat(r.details()).extracting(ScanResult.Detail::outcome).containsOnly("would_create");
        assertThat(jobs.count()).isZero();
    }

    @Test
    void rescanDoesNotDuplicateOpenJobs() {
        var first = pipeline.scan(null, false);
        var second = pipeline.scan(null, false);

        assertThat(first.jobsCreated()).isEqualTo(3);
        assertThat(second.jobsCreated()).isZero();
        assertThat(second.jobsSkippedExisting()).isEqualTo(3);
        assertThat(jobs.count()).isEqualTo(3);
    }

    @Test
    void severityFilterNarrowsTheScan() {
        var r = pipeline.scan(List.of(Severity.CRITICAL), true);

        assertThat(r.scanned()).isEqualTo(1);
        assertThat(r.details()).singleElement()
                .satisfies(d -> assertThat(d.softwareName()).isEqualTo("Google Chrome"));
    }

    @Test
    void approvalGatesExecution() {
        pipeline.scan(null, false);
        var j = job("rem-ws1", "CVE-2024-1001");
        assertThat(j.status()).isEqualTo(JobStatus.PENDING);
        assertThat(j.requiresApproval()).isTrue();
        assertThat(j.createdAt()).isNotNull();

        assertThatThrownBy(() -> pipeline.execute(j.id()))
                .isInstanceOfSatisfying(ConflictException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.APPROVAL_REQUIRED));

        var approved = pipeline.approve(j.id(), "token-1");
        assertThat(approved.status()).isEqualTo(JobStatus.APPROVED);
        assertThat(approved.approvedBy()).isEqualTo("token-1");

        var running = pipeline.execute(j.id());
        assertThat(running.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(gateway.drain("rem-ws1", 10)).anySatisfy(c -> {
            assertThat(c.type()).isEqualTo(AgentCommand.Type.REMEDIATE);
            assertThat(String.valueOf(c.payload().get("command"))).contains("winget upgrade");
        });

        var done = pipeline.reportResult(j.id(), "rem-ws1", new JobResultReport(JobStatus.SUCCESS, 0, "upgraded", null));
        assertThat(done.status()).isEqualTo(JobStatus.SUCCESS);

        // duplicate callback is ignored
        var dup = pipeline.reportResult(j.id(), "rem-ws1", new JobResultReport(JobStatus.FAILED, 1, null, "late"));
        assertThat(dup.status()).isEqualTo(JobStatus.SUCCESS);
    }

    @Test
    void offlineNodeFailsWithReasonCode() {
        pipeline.scan(null, false);
        var j = job("rem-ws2", "CVE-2024-1001");
        pipeline.approve(j.id(), "token-1");

        var failed = pipeline.execute(j.id());

        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.reasonCode()).isEqualTo(RemediationPipeline.REASON_NODE_OFFLINE);
    }

    @Test
    void bulkApproveSkipsJobsThatAreNotWaiting() {
        pipeline.scan(null, false);
        var a = job("rem-ws1", "CVE-2024-1001");
        var b = job("rem-ws1", "CVE-2024-1002");
        pipeline.approve(a.id(), "token-1");

        assertThat(pipeline.approveAll(List.of(a.id(), b.id(), 999_999L), "token-2")).isEqualTo(1);
        assertThat(pipeline.get(b.id()).approvedBy()).isEqualTo("token-2");
    }

    @Test
    void failedScriptFixCanBeRolledBackOrRetried() {
        pipeline.scan(null, false);
        var chrome = job("rem-ws1", "CVE-2024-1002");
        var zip = job("rem-ws1", "CVE-2024-1001");
        for (var j : List.of(chrome, zip)) {
            pipeline.approve(j.id(), "token-1");
            pipeline.execute(j.id());
            pipeline.reportResult(j.id(), "rem-ws1", new JobResultReport(JobStatus.FAILED, 1, null, "exit 1"));
        }

        var rolledBack = pipeline.rollback(chrome.id());
        assertThat(rolledBack.status()).isEqualTo(JobStatus.ROLLED_BACK);

        var retried = pipeline.retry(zip.id());
        assertThat(retried.status()).isEqualTo(JobStatus.PENDING);
        assertThat(retried.attempts()).isEqualTo(1);
    }

    @Test
    void failedJobDoesNotBlockTheNextScan() {
        pipeline.scan(null, false);
        var old = job("rem-ws1", "CVE-2024-1001");
        pipeline.approve(old.id(), "token-1");
        pipeline.execute(old.id());
        pipeline.reportResult(old.id(), "rem-ws1", new JobResultReport(JobStatus.FAILED, 1, null, "exit 1"));

        var preview = pipeline.scan(null, true);
        assertThat(preview.details())
                .filteredOn(d -> d.nodeId().equals("rem-ws1") && d.cveId().equals("CVE-2024-1001"))
                .extracting(ScanResult.Detail::outcome).containsExactly("would_create");

        var rescan = pipeline.scan(null, false);
        assertThat(rescan.jobsCreated()).isEqualTo(1);
        assertThat(rescan.jobsSkippedExisting()).isEqualTo(2);

        assertThatThrownBy(() -> pipeline.retry(old.id()))
                .isInstanceOfSatisfying(ConflictException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.ILLEGAL_TRANSITION));
        assertThat(pipeline.get(old.id()).status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void resultFromAnotherNodeIsRejected() {
        pipeline.scan(null, false);
        var j = job("rem-ws1", "CVE-2024-1001");
        pipeline.approve(j.id(), "token-1");
        pipeline.execute(j.id());

        assertThatThrownBy(() -> pipeline.reportResult(j.id(), "rem-ws2",
                new JobResultReport(JobStatus.SUCCESS, 0, null, null)))
                .isInstanceOf(NotFoundException.class);
        assertThat(pipeline.get(j.id()).status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void skipIsOnlyForJobsNotYetRunning() {
        pipeline.scan(null, false);
        var j = job("rem-ws2", "CVE-2024-1001");

        assertThat(pipeline.skip(j.id()).status()).isEqualTo(JobStatus.SKIPPED);
        assertThatThrownBy(() -> pipeline.skip(j.id())).isInstanceOf(ConflictException.class);
    }
}
