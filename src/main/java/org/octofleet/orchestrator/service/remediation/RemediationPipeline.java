package org.octofleet.orchestrator.service.remediation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.JobResultReport;
import org.octofleet.orchestrator.api.dto.RemediationJobDTO;
import org.octofleet.orchestrator.api.dto.RemediationSummaryDTO;
import org.octofleet.orchestrator.api.dto.ScanResult;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.FixMethod;
import org.octofleet.orchestrator.domain.JobStatus;
import org.octofleet.orchestrator.domain.RemediationJob;
import org.octofleet.orchestrator.domain.RemediationPackage;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.repo.RemediationJobRepo;
import org.octofleet.orchestrator.repo.RemediationPackageRepo;
import org.octofleet.orchestrator.repo.RemediationRuleRepo;
import org.octofleet.orchestrator.service.ConflictException;
import org.octofleet.orchestrator.service.FleetException;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.octofleet.orchestrator.service.ValidationException;
import org.octofleet.orchestrator.service.agent.AgentCommand;
import org.octofleet.orchestrator.service.agent.AgentGateway;
import org.octofleet.orchestrator.service.deployment.MaintenanceWindowService;
import org.octofleet.orchestrator.service.deployment.PackageCatalogService;
import org.octofleet.orchestrator.service.events.EventBus;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Vulnerability remediation: scan findings into jobs, gate them on approval, run the
 * fix on the node and record the outcome. Failures before dispatch are recorded on the
 * job with a reason code; nothing on this path retries by itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemediationPipeline {

    public static final String REASON_NODE_OFFLINE = "NODE_OFFLINE";
    public static final String REASON_PACKAGE_UNAVAILABLE = "PACKAGE_UNAVAILABLE";

    private final VulnerabilitySource source;
    private final RemediationJobRepo jobs;
    private final RemediationPackageRepo packages;
    private final RemediationRuleRepo rules;
    private final PackageCatalogService softwareCatalog;
    private final MaintenanceWindowService windows;
    private final AgentGateway agents;
    private final EventBus bus;
    private final AppProps props;
    private final Clock clock;
    private final TransactionTemplate tx;

    private final AtomicBoolean autoRunning = new AtomicBoolean(false);

    // ---------------------------------------------------------------- scan

    @Transactional
    public ScanResult scan(List<Severity> severityFilter, boolean dryRun) {
        Set<Severity> severities = severityFilter == null || severityFilter.isEmpty()
                ? EnumSet.allOf(Severity.class) : EnumSet.copyOf(severityFilter);
        var findings = source.findings(severities);
        var enabledRules = rules.findByEnabledTrueOrderByIdAsc();
        var enabledPackages = packages.findByEnabledTrueOrderByIdAsc();

        int scanned = 0, withFix = 0, created = 0, existing = 0, noRule = 0;
        var details = new ArrayList<ScanResult.Detail>();
        var seen = new HashSet<String>();

        for (var f : findings) {
            if (f.severity() == null || !severities.contains(f.severity())) continue;
            scanned++;
            var pkg = RemediationMatcher.pickPackage(f, enabledPackages).orElse(null);
            if (pkg == null) continue;
            withFix++;

            var rule = RemediationMatcher.pickRule(f, enabledRules).orElse(null);
            if (rule == null) {
                noRule++;
                details.add(detail(f, pkg, null, null, "no_rule"));
                continue;
            }
            var key = f.nodeId() + "|" + f.cveId();
            if (!seen.add(key) || jobs.existsByNodeIdAndCveIdAndStatusIn(f.nodeId(), f.cveId(), JobStatus.OPEN)) {
                existing++;
                details.add(detail(f, pkg, rule.getId(), rule.isRequireApproval(), "existing"));
                continue;
            }
            if (dryRun) {
                details.add(detail(f, pkg, rule.getId(), rule.isRequireApproval(), "would_create"));
                continue;
            }
            var job = RemediationJob.builder()
                    .nodeId(f.nodeId())
                    .cveId(f.cveId())
                    .softwareName(f.softwareName())
                    .softwareVersion(f.softwareVersion())
                    .severity(f.severity())
                    .remediationPackage(pkg)
                    .rule(rule)
                    .requiresApproval(rule.isRequireApproval())
                    .status(JobStatus.PENDING)
                    .attempts(0)
                    .createdAt(clock.instant())
                    .build();
            if (!rule.isRequireApproval()) {
                job.setStatus(JobStatus.APPROVED);
                job.setApprovedBy("auto");
                job.setApprovedAt(clock.instant());
            }
            jobs.save(job);
            created++;
            details.add(detail(f, pkg, rule.getId(), rule.isRequireApproval(), "created"));
            publish(toDto(job));
        }
        log.info("[Remediation] scan{} severities={} scanned={} fixable={} created={} existing={} no_rule={}",
                dryRun ? " (dry run)" : "", severities, scanned, withFix, created, existing, noRule);
        return new ScanResult(scanned, withFix, created, existing, noRule, details);
    }

    private static ScanResult.Detail detail(Finding f, RemediationPackage pkg, Long ruleId, Boolean approval, String outcome) {
        return new ScanResult.Detail(f.nodeId(), f.cveId(), f.softwareName(), f.softwareVersion(), f.severity(),
                pkg.getId(), pkg.getName(), ruleId, approval, outcome);
    }

    // ---------------------------------------------------------------- approval

    @Transactional
    public RemediationJobDTO approve(Long jobId, String approvedBy) {
        var job = lock(jobId);
        if (!job.isRequiresApproval()) {
            throw new ConflictException(ErrorCode.NOT_REQUIRING_APPROVAL, "job " + jobId + " does not require approval");
        }
        if (job.getStatus() != JobStatus.PENDING) {
            throw ConflictException.illegalTransition("job", jobId, job.getStatus().wire(), JobStatus.APPROVED.wire());
        }
        job.setStatus(JobStatus.APPROVED);
        job.setApprovedBy(approvedBy);
        job.setApprovedAt(clock.instant());
        log.info("[Remediation] job {} approved by {}", jobId, approvedBy);
        var dto = toDto(job);
        publish(dto);
        return dto;
    }

    /** Bulk approval; jobs that are not pending-awaiting-approval are left alone. */
    public int approveAll(List<Long> jobIds, String approvedBy) {
        int n = 0;
        for (var id : jobIds) {
            Boolean ok = tx.execute(s -> {
                var job = jobs.findForUpdate(id).orElse(null);
                if (job == null || !job.isRequiresApproval() || job.getStatus() != JobStatus.PENDING) {
                    log.debug("[Remediation] bulk approve skips job {}", id);
                    return false;
                }
                job.setStatus(JobStatus.APPROVED);
                job.setApprovedBy(approvedBy);
                job.setApprovedAt(clock.instant());
                publish(toDto(job));
                return true;
            });
            if (Boolean.TRUE.equals(ok)) n++;
        }
        log.info("[Remediation] {} of {} job(s) approved by {}", n, jobIds.size(), approvedBy);
        return n;
    }

    // ---------------------------------------------------------------- execution

    private record Dispatch(RemediationJobDTO job, AgentCommand command) {}

    /**
     * approved -&gt; running and hands the fix to the node. A pending job that needs approval
     * is refused; a pending job that does not is approved on the way.
     */
    public RemediationJobDTO execute(Long jobId) {
        var prepared = tx.execute(s -> prepare(jobId));
        if (prepared.command() == null) return prepared.job();
        var nodeId = prepared.job().nodeId();
        try {
            agents.dispatch(nodeId, prepared.command());
            return prepared.job();
        } catch (UpstreamUnavailableException e) {
            log.warn("[Remediation] job {} dispatch to {} failed: {}", jobId, nodeId, e.getMessage());
            return tx.execute(s -> {
                var job = lock(jobId);
                if (job.getStatus() == JobStatus.RUNNING) fail(job, REASON_NODE_OFFLINE, e.getMessage());
                return toDto(job);
            });
        }
    }

    private Dispatch prepare(Long jobId) {
        var job = lock(jobId);
        if (job.getStatus() == JobStatus.PENDING) {
            if (job.isRequiresApproval()) {
                throw new ConflictException(ErrorCode.APPROVAL_REQUIRED, "job " + jobId + " is waiting for approval");
            }
            job.setStatus(JobStatus.APPROVED);
            job.setApprovedBy("auto");
            job.setApprovedAt(clock.instant());
        }
        if (job.getStatus() != JobStatus.APPROVED) {
            throw ConflictException.illegalTransition("job", jobId, job.getStatus().wire(), JobStatus.RUNNING.wire());
        }

        var pkg = job.getRemediationPackage();
        if (!pkg.isEnabled() || (pkg.getFixMethod() == FixMethod.PACKAGE && !softwareCatalog.isActive(pkg.getSoftwarePackageId()))) {
            fail(job, REASON_PACKAGE_UNAVAILABLE, "remediation package " + pkg.getId() + " is disabled or has no active package");
            return new Dispatch(toDto(job), null);
        }
        if (!agents.isReachable(job.getNodeId())) {
            fail(job, REASON_NODE_OFFLINE, "node " + job.getNodeId() + " is offline");
            return new Dispatch(toDto(job), null);
        }

        var command = FixCommandBuilder.fixCommand(job, pkg);
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(clock.instant());
        job.setCompletedAt(null);
        log.info("[Remediation] job {} running on {}: {}", jobId, job.getNodeId(), command);
        var dto = toDto(job);
        publish(dto);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("job_id", job.getId());
        payload.put("cve_id", job.getCveId());
        payload.put("fix_method", pkg.getFixMethod().wire());
        payload.put("command", command);
        return new Dispatch(dto, AgentCommand.of(AgentCommand.Type.REMEDIATE, String.valueOf(job.getId()), payload));
    }

    private void fail(RemediationJob job, String reasonCode, String message) {
        job.setStatus(JobStatus.FAILED);
        job.setReasonCode(reasonCode);
        job.setErrorMessage(message);
        job.setCompletedAt(clock.instant());
        log.warn("[Remediation] job {} failed before dispatch: {} ({})", job.getId(), reasonCode, message);
        publish(toDto(job));
    }

    /**
     * Agent outcome: running -&gt; success | failed. Anything else is a stale duplicate.
     * A node can only report on its own jobs.
     */
    @Transactional
    public RemediationJobDTO reportResult(Long jobId, String nodeId, JobResultReport report) {
        var next = report.status();
        if (next != JobStatus.SUCCESS && next != JobStatus.FAILED) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "agents report success or failed");
        }
        var job = lock(jobId);
        if (!job.getNodeId().equals(nodeId)) {
            throw new NotFoundException("job", nodeId + "/" + jobId);
        }
        if (job.getStatus() != JobStatus.RUNNING) {
            log.debug("[Remediation] job {} ignoring {} report (job is {})", jobId, next, job.getStatus());
            return toDto(job);
        }
        job.setStatus(next);
        job.setExitCode(report.exitCode());
        job.setOutput(truncate(report.output(), 4000));
        job.setErrorMessage(next == JobStatus.FAILED ? truncate(report.errorMessage(), 2000) : null);
        job.setReasonCode(null);
        job.setCompletedAt(clock.instant());
        log.info("[Remediation] job {} {} (exit {})", jobId, next.wire(), report.exitCode());
        var dto = toDto(job);
        publish(dto);
        return dto;
    }

    /**
     * failed -&gt; pending, attempts + 1; approved straight away if the job never needed approval.
     * Refused once a rescan has opened a newer job for the same node and CVE.
     */
    @Transactional
    public RemediationJobDTO retry(Long jobId) {
        var job = lock(jobId);
        if (job.getStatus() != JobStatus.FAILED) {
            throw ConflictException.illegalTransition("job", jobId, job.getStatus().wire(), JobStatus.PENDING.wire());
        }
        if (jobs.existsByNodeIdAndCveIdAndStatusInAndIdNot(job.getNodeId(), job.getCveId(), JobStatus.OPEN, jobId)) {
            throw new ConflictException(ErrorCode.ILLEGAL_TRANSITION,
                    "job " + jobId + " was superseded by a newer job for " + job.getCveId() + " on " + job.getNodeId());
        }
        job.setAttempts(job.getAttempts() + 1);
        job.setReasonCode(null);
        job.setExitCode(null);
        job.setCompletedAt(null);
        job.setStartedAt(null);
        if (job.isRequiresApproval()) {
            job.setStatus(JobStatus.PENDING);
            job.setApprovedBy(null);
            job.setApprovedAt(null);
        } else {
            job.setStatus(JobStatus.APPROVED);
        }
        log.info("[Remediation] job {} retry #{}", jobId, job.getAttempts());
        var dto = toDto(job);
        publish(dto);
        return dto;
    }

    /** failed -&gt; rolled_back (terminal); the undo command is sent best-effort. */
    public RemediationJobDTO rollback(Long jobId) {
        var prepared = tx.execute(s -> {
            var job = lock(jobId);
            if (job.getStatus() != JobStatus.FAILED) {
                throw ConflictException.illegalTransition("job", jobId, job.getStatus().wire(), JobStatus.ROLLED_BACK.wire());
            }
            var command = FixCommandBuilder.rollbackCommand(job, job.getRemediationPackage())
                    .orElseThrow(() -> new ConflictException(ErrorCode.ROLLBACK_UNSUPPORTED,
                            "fix method " + job.getRemediationPackage().getFixMethod().wire() + " of job " + jobId + " cannot be rolled back"));
            job.setStatus(JobStatus.ROLLED_BACK);
            job.setCompletedAt(clock.instant());
            log.info("[Remediation] job {} rolled back: {}", jobId, command);
            var dto = toDto(job);
            publish(dto);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("job_id", job.getId());
            payload.put("command", command);
            return new Dispatch(dto, AgentCommand.of(AgentCommand.Type.ROLLBACK, String.valueOf(job.getId()), payload));
        });
        try {
            agents.dispatch(prepared.job().nodeId(), prepared.command());
        } catch (UpstreamUnavailableException e) {
            log.warn("[Remediation] rollback command for job {} not delivered: {}", jobId, e.getMessage());
        }
        return prepared.job();
    }

    @Transactional
    public RemediationJobDTO skip(Long jobId) {
        var job = lock(jobId);
        if (job.getStatus() != JobStatus.PENDING && job.getStatus() != JobStatus.APPROVED) {
            throw ConflictException.illegalTransition("job", jobId, job.getStatus().wire(), JobStatus.SKIPPED.wire());
        }
        job.setStatus(JobStatus.SKIPPED);
        job.setCompletedAt(clock.instant());
        var dto = toDto(job);
        publish(dto);
        return dto;
    }

    /**
     * Runs approved jobs whose rule asks for automatic remediation, once their node is
     * online and, where the rule says so, inside a maintenance window.
     */
    @Scheduled(fixedDelayString = "${app.remediation.auto-execute-ms:60000}")
    public int autoExecute() {
        if (!autoRunning.compareAndSet(false, true)) return 0;
        int started = 0;
        try {
            var now = clock.instant();
            for (var id : jobs.findAutoRemediateIds(JobStatus.APPROVED)) {
                var job = jobs.findById(id).orElse(null);
                if (job == null || job.getStatus() != JobStatus.APPROVED) continue;
                if (!agents.isReachable(job.getNodeId())) continue;
                if (job.getRule() != null && job.getRule().isMaintenanceWindowOnly()
                        && !windows.inWindow(job.getNodeId(), now)) continue;
                try {
                    var dto = execute(id);
                    if (dto.status() == JobStatus.RUNNING) started++;
                } catch (FleetException e) {
                    log.debug("[Remediation] auto-execute skipped job {}: {}", id, e.getMessage());
                }
            }
        } finally {
            autoRunning.set(false);
        }
        if (started > 0) log.info("[Remediation] auto-executed {} job(s)", started);
        return started;
    }

    // ---------------------------------------------------------------- queries

    @Transactional(readOnly = true)
    public RemediationJobDTO get(Long id) {
        return toDto(jobs.findById(id).orElseThrow(() -> new NotFoundException("job", id)));
    }

    @Transactional(readOnly = true)
    public List<RemediationJobDTO> list(JobStatus status, String nodeId, int limit, int offset) {
        var page = PageRequest.of(Math.max(0, offset / Math.max(1, limit)), Math.max(1, limit));
        var result = status != null ? jobs.findByStatusOrderByCreatedAtDesc(status, page)
                : nodeId != null ? jobs.findByNodeIdOrderByCreatedAtDesc(nodeId, page)
                : jobs.findAllByOrderByCreatedAtDesc(page);
        return result.stream().map(RemediationPipeline::toDto).toList();
    }

    @Transactional(readOnly = true)
    public RemediationSummaryDTO summary() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (var s : JobStatus.values()) {
            long c = jobs.countByStatus(s);
            if (c > 0) counts.put(s.wire(), c);
        }
        int recentLimit = props.remediation() == null || props.remediation().recentJobs() <= 0 ? 10 : props.remediation().recentJobs();
        var recent = jobs.findAllByOrderByCreatedAtDesc(PageRequest.of(0, recentLimit)).stream()
                .map(RemediationPipeline::toDto).toList();

        var enabledPackages = packages.findByEnabledTrueOrderByIdAsc();
        long fixable = source.findings(EnumSet.of(Severity.CRITICAL, Severity.HIGH)).stream()
                .filter(f -> enabledPackages.stream()
                        .anyMatch(p -> RemediationMatcher.softwareMatches(p.getTargetSoftware(), f.softwareName())))
                .count();

        return new RemediationSummaryDTO(counts, recent,
                packages.countByEnabledTrue(), rules.countByEnabledTrue(),
                fixable, windows.anyOpen(clock.instant()));
    }

    // ---------------------------------------------------------------- mapping

    private RemediationJob lock(Long jobId) {
        return jobs.findForUpdate(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    private void publish(RemediationJobDTO dto) {
        bus.publish(EventBus.REMEDIATION, "job_update", "job", dto);
    }

    static RemediationJobDTO toDto(RemediationJob j) {
        var pkg = j.getRemediationPackage();
        return new RemediationJobDTO(j.getId(), j.getNodeId(), j.getCveId(),
                j.getSoftwareName(), j.getSoftwareVersion(), j.getSeverity(),
                pkg.getId(), pkg.getName(), pkg.getFixMethod(),
                j.getRule() == null ? null : j.getRule().getId(),
                j.getStatus(), j.isRequiresApproval(),
                j.getApprovedBy(), j.getApprovedAt(),
                j.getAttempts(), j.getReasonCode(),
                j.getExitCode(), j.getErrorMessage(), j.getOutput(),
                j.getCreatedAt(), j.getStartedAt(), j.getCompletedAt());
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
