package org.octofleet.orchestrator.service.deployment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.CreateDeploymentRequest;
import org.octofleet.orchestrator.api.dto.DeploymentDTO;
import org.octofleet.orchestrator.api.dto.NodeResultReport;
import org.octofleet.orchestrator.api.dto.NodeStatusDTO;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.*;
import org.octofleet.orchestrator.repo.DeploymentRepo;
import org.octofleet.orchestrator.repo.NodeDeploymentStatusRepo;
import org.octofleet.orchestrator.service.ConflictException;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.octofleet.orchestrator.service.ValidationException;
import org.octofleet.orchestrator.service.agent.AgentCommand;
import org.octofleet.orchestrator.service.agent.AgentGateway;
import org.octofleet.orchestrator.service.events.EventBus;
import org.octofleet.orchestrator.service.group.TargetResolver;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives package rollouts. Every per-node transition is a read-modify-write of one
 * {@link NodeDeploymentStatus} row under its row lock; deployment-level transitions
 * lock the deployment row. Unrelated nodes and deployments never wait on each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentOrchestrator {

    private static final Set<NodeRolloutStatus> TERMINAL =
            EnumSet.of(NodeRolloutStatus.SUCCESS, NodeRolloutStatus.FAILED, NodeRolloutStatus.SKIPPED);
    private static final Set<NodeRolloutStatus> IN_FLIGHT =
            EnumSet.of(NodeRolloutStatus.DOWNLOADING, NodeRolloutStatus.INSTALLING);

    private final DeploymentRepo deployments;
    private final NodeDeploymentStatusRepo rows;
    private final PackageCatalogService catalog;
    private final TargetResolver targets;
    private final MaintenanceWindowService windows;
    private final AgentGateway agents;
    private final EventBus bus;
    private final AppProps props;
    private final Clock clock;
    private final TransactionTemplate tx;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    // ---------------------------------------------------------------- commands

    @Transactional
    public DeploymentDTO create(CreateDeploymentRequest r, String actor) {
        if (r.scheduledStart() != null && r.scheduledEnd() != null && !r.scheduledEnd().isAfter(r.scheduledStart())) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "scheduled_end must be after scheduled_start");
        }
        var pkg = catalog.requireActive(r.packageName(), r.packageVersion());
        var nodeIds = targets.resolve(r.targetType(), r.targetId());

        var d = Deployment.builder()
                .name(r.name().trim())
                .packageId(pkg.getId())
                .packageName(pkg.getName())
                .packageVersion(pkg.getVersion())
                .targetType(r.targetType())
                .targetId(r.targetId() == null ? null : r.targetId().trim())
                .mode(r.mode() == null ? RolloutMode.REQUIRED : r.mode())
                .status(DeploymentStatus.PENDING)
                .scheduledStart(r.scheduledStart())
                .scheduledEnd(r.scheduledEnd())
                .maintenanceWindowOnly(r.maintenanceWindowOnly())
                .createdBy(actor)
                .createdAt(clock.instant())
                .build();
        for (var nodeId : nodeIds) {
            d.addNode(NodeDeploymentStatus.builder()
                    .nodeId(nodeId)
                    .status(NodeRolloutStatus.PENDING)
                    .attempts(0)
                    .build());
        }
        deployments.save(d);
        log.info("[Deploy] created {} '{}' {} {} -> {} node(s)", d.getId(), d.getName(),
                pkg.getName(), pkg.getVersion(), nodeIds.size());
        var dto = toDto(d, d.getNodes());
        publishDeployment(dto);
        return dto;
    }

    /**
     * PATCH {status}: active (activate or resume), paused, cancelled.
     * Anything else, or a move the current state does not allow, is a 409.
     */
    public DeploymentDTO changeStatus(String id, DeploymentStatus next) {
        switch (next) {
            case ACTIVE -> {
                tx.executeWithoutResult(s -> transition(id, DeploymentStatus.ACTIVE));
                dispatchEligible(id);
            }
            case PAUSED -> tx.executeWithoutResult(s -> transition(id, DeploymentStatus.PAUSED));
            case CANCELLED -> tx.executeWithoutResult(s -> cancelLocked(id));
            default -> {
                var current = get(id).status();
                throw ConflictException.illegalTransition("deployment", id, current.wire(), next.wire());
            }
        }
        return get(id);
    }

    public DeploymentDTO activate(String id) { return changeStatus(id, DeploymentStatus.ACTIVE); }
    public DeploymentDTO pause(String id) { return changeStatus(id, DeploymentStatus.PAUSED); }
    public DeploymentDTO resume(String id) { return changeStatus(id, DeploymentStatus.ACTIVE); }
    public DeploymentDTO cancel(String id) { return changeStatus(id, DeploymentStatus.CANCELLED); }

    private void transition(String id, DeploymentStatus next) {
        var d = lockDeployment(id);
        var from = d.getStatus();
        if (!from.canTransitionTo(next)) {
            throw ConflictException.illegalTransition("deployment", id, from.wire(), next.wire());
        }
        d.setStatus(next);
        if (from == DeploymentStatus.PENDING && next == DeploymentStatus.ACTIVE) {
            d.setActivatedAt(clock.instant());
        }
        log.info("[Deploy] {} {} -> {}", id, from.wire(), next.wire());
        publishDeployment(toDto(d, rows.findByDeployment(id)));
    }

    private void cancelLocked(String id) {
        var d = lockDeployment(id);
        var from = d.getStatus();
        if (!from.canTransitionTo(DeploymentStatus.CANCELLED)) {
            throw ConflictException.illegalTransition("deployment", id, from.wire(), DeploymentStatus.CANCELLED.wire());
        }
        var now = clock.instant();
        d.setStatus(DeploymentStatus.CANCELLED);
        d.setCompletedAt(now);
        int skipped = 0;
        for (var nodeId : rows.findNodeIds(id, NodeRolloutStatus.PENDING)) {
            var row = rows.findForUpdate(id, nodeId).orElse(null);
            if (row == null || row.getStatus() != NodeRolloutStatus.PENDING) continue;
            row.setStatus(NodeRolloutStatus.SKIPPED);
            row.setCompletedAt(now);
            row.setErrorMessage("deployment cancelled");
            skipped++;
        }
        log.info("[Deploy] {} cancelled from {}, {} pending node(s) skipped", id, from.wire(), skipped);
        publishDeployment(toDto(d, rows.findByDeployment(id)));
    }

    @Transactional
    public void delete(String id) {
        var d = deployments.findById(id).orElseThrow(() -> new NotFoundException("deployment", id));
        deployments.delete(d);
        log.info("[Deploy] deleted {}", id);
        var gone = new LinkedHashMap<String, Object>();
        gone.put("id", id);
        bus.publish(EventBus.DEPLOYMENTS, "deployment_deleted", "deployment", gone);
    }

    /** Operator retry of one failed node: failed -> pending, attempts + 1. */
    public NodeStatusDTO retryNode(String deploymentId, String nodeId) {
        var dto = tx.execute(s -> {
            var d = lockDeployment(deploymentId);
            if (d.getStatus() != DeploymentStatus.ACTIVE && d.getStatus() != DeploymentStatus.PAUSED) {
                throw ConflictException.illegalTransition("deployment", deploymentId, d.getStatus().wire(), "retry");
            }
            var row = rows.findForUpdate(deploymentId, nodeId)
                    .orElseThrow(() -> new NotFoundException("deployment node", deploymentId + "/" + nodeId));
            if (row.getStatus() != NodeRolloutStatus.FAILED) {
                throw ConflictException.illegalTransition("deployment node", nodeId,
                        row.getStatus().wire(), NodeRolloutStatus.PENDING.wire());
            }
            row.setStatus(NodeRolloutStatus.PENDING);
            row.setAttempts(row.getAttempts() + 1);
            row.setCompletedAt(null);
            log.info("[Deploy] {} node {} manual retry, attempt {}", deploymentId, nodeId, row.getAttempts());
            var out = toDto(row, deploymentId);
            publishNode(out);
            return out;
        });
        dispatchEligible(deploymentId);
        return dto;
    }

    // ---------------------------------------------------------------- agent callback

    /**
     * Applies an agent outcome to one node row. Reports for rows that are not in
     * flight, that belong to an earlier attempt, or that would not move the row
     * forward are stale duplicates and change nothing.
     */
    public NodeStatusDTO reportNodeResult(String deploymentId, String nodeId, NodeResultReport report) {
        var next = report.status();
        if (next == NodeRolloutStatus.PENDING || next == NodeRolloutStatus.SKIPPED) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "agents report downloading, installing, success or failed");
        }
        var applied = tx.execute(s -> applyReport(deploymentId, nodeId, report));
        if (applied == null) {
            return tx.execute(s -> rows.findForUpdate(deploymentId, nodeId).map(r -> toDto(r, deploymentId)).orElseThrow());
        }
        if (applied.status().isTerminal()) {
            completeIfFinished(deploymentId);
        }
        return applied;
    }

    private NodeStatusDTO applyReport(String deploymentId, String nodeId, NodeResultReport report) {
        var row = rows.findForUpdate(deploymentId, nodeId)
                .orElseThrow(() -> new NotFoundException("deployment node", deploymentId + "/" + nodeId));
        var cur = row.getStatus();
        var next = report.status();
        if (!cur.isInFlight() || report.attempt() == null || report.attempt() != row.getAttempts()
                || !next.isAfter(cur)) {
            log.debug("[Deploy] {} node {} ignoring stale report {} for attempt {} (row is {}, attempt {})",
                    deploymentId, nodeId, next, report.attempt(), cur, row.getAttempts());
            return null;
        }
        switch (next) {
            case DOWNLOADING, INSTALLING -> row.setStatus(next);
            case SUCCESS -> {
                row.setStatus(NodeRolloutStatus.SUCCESS);
                row.setCompletedAt(clock.instant());
                row.setExitCode(report.exitCode());
                row.setOutput(truncate(report.output(), 4000));
                row.setErrorMessage(null);
            }
            case FAILED -> {
                row.setExitCode(report.exitCode());
                row.setOutput(truncate(report.output(), 4000));
                failAttempt(row, report.errorMessage() == null
                        ? "install failed (exit " + report.exitCode() + ")" : report.errorMessage());
            }
            default -> throw new IllegalStateException("unexpected report " + next);
        }
        var dto = toDto(row, deploymentId);
        publishNode(dto);
        return dto;
    }

    /** Ends the row's current attempt as failed: back to pending while retries remain, else terminal. */
    private void failAttempt(NodeDeploymentStatus row, String error) {
        var deploymentId = row.getDeployment().getId();
        row.setErrorMessage(truncate(error, 2000));
        var dStatus = row.getDeployment().getStatus();
        boolean retryable = row.getAttempts() < retryCeiling()
                && (dStatus == DeploymentStatus.ACTIVE || dStatus == DeploymentStatus.PAUSED);
        if (retryable) {
            row.setStatus(NodeRolloutStatus.PENDING);
            row.setAttempts(row.getAttempts() + 1);
            log.warn("[Deploy] {} node {} failed, retry {}/{}", deploymentId, row.getNodeId(), row.getAttempts(), retryCeiling());
        } else {
            row.setStatus(NodeRolloutStatus.FAILED);
            row.setCompletedAt(clock.instant());
            log.warn("[Deploy] {} node {} failed permanently after {} retries", deploymentId, row.getNodeId(), row.getAttempts());
        }
    }

    /**
     * Rows dispatched longer than the in-flight timeout ago with no outcome lost their
     * command or their agent; the attempt is counted as failed.
     * @return number of rows timed out
     */
    int expireInFlight(String deploymentId) {
        var timeout = inFlightTimeout();
        var cutoff = clock.instant().minus(timeout);
        int expired = 0;
        for (var nodeId : rows.findNodeIdsAttemptedBefore(deploymentId, IN_FLIGHT, cutoff)) {
            Boolean done = tx.execute(s -> {
                var row = rows.findForUpdate(deploymentId, nodeId).orElse(null);
                if (row == null || !row.getStatus().isInFlight()
                        || row.getLastAttemptAt() == null || !row.getLastAttemptAt().isBefore(cutoff)) return false;
                failAttempt(row, "no result from agent within " + timeout.toMinutes() + " min");
                publishNode(toDto(row, deploymentId));
                return true;
            });
            if (Boolean.TRUE.equals(done)) expired++;
        }
        return expired;
    }

    /** Completes an active or paused deployment once no row is left non-terminal. */
    public boolean completeIfFinished(String deploymentId) {
        Boolean done = tx.execute(s -> {
            var d = deployments.findForUpdate(deploymentId).orElse(null);
            if (d == null) return false;
            if (d.getStatus() != DeploymentStatus.ACTIVE && d.getStatus() != DeploymentStatus.PAUSED) return false;
            if (rows.countNotIn(deploymentId, TERMINAL) > 0) return false;
            d.setStatus(DeploymentStatus.COMPLETED);
            d.setCompletedAt(clock.instant());
            log.info("[Deploy] {} completed", deploymentId);
            publishDeployment(toDto(d, rows.findByDeployment(deploymentId)));
            return true;
        });
        return Boolean.TRUE.equals(done);
    }

    // ---------------------------------------------------------------- dispatch

    /**
     * One eligibility pass over a deployment's pending rows.
     * @return number of install commands handed to agents
     */
    public int dispatchEligible(String deploymentId) {
        var d = deployments.findById(deploymentId).orElse(null);
        if (d == null || d.getStatus() != DeploymentStatus.ACTIVE) return 0;
        var now = clock.instant();
        if (d.getScheduledStart() != null && now.isBefore(d.getScheduledStart())) return 0;
        if (d.getScheduledEnd() != null && now.isAfter(d.getScheduledEnd())) {
            expirePending(deploymentId);
            return 0;
        }

        int dispatched = 0;
        for (var nodeId : rows.findNodeIds(deploymentId, NodeRolloutStatus.PENDING)) {
            if (!agents.isReachable(nodeId)) continue;
            if (d.isMaintenanceWindowOnly() && !windows.inWindow(nodeId, now)) continue;
            if (dispatchOne(d, nodeId)) dispatched++;
        }
        if (dispatched > 0) log.info("[Deploy] {} dispatched to {} node(s)", deploymentId, dispatched);
        return dispatched;
    }

    private boolean dispatchOne(Deployment d, String nodeId) {
        var id = d.getId();
        Integer attempt = tx.execute(s -> {
            var row = rows.findForUpdate(id, nodeId).orElse(null);
            // at most one in-flight command per (deployment, node)
            if (row == null || row.getStatus() != NodeRolloutStatus.PENDING) return null;
            if (row.getDeployment().getStatus() != DeploymentStatus.ACTIVE) return null;
            var now = clock.instant();
            row.setStatus(NodeRolloutStatus.DOWNLOADING);
            if (row.getStartedAt() == null) row.setStartedAt(now);
            row.setLastAttemptAt(now);
            publishNode(toDto(row, id));
            return row.getAttempts();
        });
        if (attempt == null) return false;

        try {
            agents.dispatch(nodeId, installCommand(d, attempt));
            return true;
        } catch (UpstreamUnavailableException e) {
            log.warn("[Deploy] {} node {} dispatch failed, back to pending: {}", id, nodeId, e.getMessage());
            tx.executeWithoutResult(s -> rows.findForUpdate(id, nodeId).ifPresent(row -> {
                if (row.getStatus() == NodeRolloutStatus.DOWNLOADING) {
                    row.setStatus(NodeRolloutStatus.PENDING);
                    publishNode(toDto(row, id));
                }
            }));
            return false;
        }
    }

    private AgentCommand installCommand(Deployment d, int attempt) {
        var pkg = catalog.find(d.getPackageId());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("deployment_id", d.getId());
        // echoed back on every status report for this attempt
        payload.put("attempt", attempt);
        payload.put("package_name", pkg.getName());
        payload.put("package_version", pkg.getVersion());
        payload.put("mode", d.getMode().wire());
        if (pkg.getInstallerUrl() != null) payload.put("installer_url", pkg.getInstallerUrl());
        if (pkg.getSha256() != null) payload.put("sha256", pkg.getSha256());
        var uninstall = d.getMode() == RolloutMode.UNINSTALL;
        var command = uninstall ? pkg.getUninstallCommand() : pkg.getInstallCommand();
        if (command != null) payload.put("command", command);
        return AgentCommand.of(uninstall ? AgentCommand.Type.UNINSTALL : AgentCommand.Type.INSTALL, d.getId(), payload);
    }

    /** Rows still pending once the schedule has closed will never run. */
    private void expirePending(String deploymentId) {
        int expired = 0;
        for (var nodeId : rows.findNodeIds(deploymentId, NodeRolloutStatus.PENDING)) {
            Boolean done = tx.execute(s -> {
                var row = rows.findForUpdate(deploymentId, nodeId).orElse(null);
                if (row == null || row.getStatus() != NodeRolloutStatus.PENDING) return false;
                row.setStatus(NodeRolloutStatus.SKIPPED);
                row.setCompletedAt(clock.instant());
                row.setErrorMessage("schedule window elapsed");
                publishNode(toDto(row, deploymentId));
                return true;
            });
            if (Boolean.TRUE.equals(done)) expired++;
        }
        if (expired > 0) log.warn("[Deploy] {} schedule elapsed, {} node(s) skipped", deploymentId, expired);
        completeIfFinished(deploymentId);
    }

    /**
     * Reconciliation sweep: times out in-flight rows that never got an outcome, then
     * retries dispatch to nodes that were offline or outside their window. Never runs
     * concurrently with itself.
     */
    @Scheduled(fixedDelayString = "${app.deployments.reconcile-ms:30000}")
    public int reconcile() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("[Deploy] reconciliation already running, skipped");
            return 0;
        }
        var started = clock.instant();
        int dispatched = 0;
        try {
            for (var id : deployments.findIdsByStatus(DeploymentStatus.PAUSED)) {
                try {
                    if (expireInFlight(id) > 0) completeIfFinished(id);
                } catch (RuntimeException e) {
                    log.error("[Deploy] reconciliation of {} failed", id, e);
                }
            }
            for (var id : deployments.findIdsByStatus(DeploymentStatus.ACTIVE)) {
                try {
                    expireInFlight(id);
                    dispatched += dispatchEligible(id);
                    completeIfFinished(id);
                } catch (RuntimeException e) {
                    log.error("[Deploy] reconciliation of {} failed", id, e);
                }
            }
        } finally {
            sweeping.set(false);
        }
        var took = Duration.between(started, clock.instant());
        if (took.compareTo(sweepWarnAfter()) > 0) {
            log.warn("[Deploy] reconciliation sweep overran: {} ms (limit {} ms)", took.toMillis(), sweepWarnAfter().toMillis());
        }
        return dispatched;
    }

    // ---------------------------------------------------------------- queries

    @Transactional(readOnly = true)
    public DeploymentDTO get(String id) {
        var d = deployments.findById(id).orElseThrow(() -> new NotFoundException("deployment", id));
        return toDto(d, rows.findByDeployment(id));
    }

    @Transactional(readOnly = true)
    public List<DeploymentDTO> list(DeploymentStatus status, int limit, int offset) {
        var page = PageRequest.of(Math.max(0, offset / Math.max(1, limit)), Math.max(1, limit));
        var result = status == null
                ? deployments.findAllByOrderByCreatedAtDesc(page)
                : deployments.findByStatusOrderByCreatedAtDesc(status, page);
        return result.stream().map(d -> toDto(d, rows.findByDeployment(d.getId()))).toList();
    }

    @Transactional(readOnly = true)
    public List<NodeStatusDTO> nodes(String id) {
        if (!deployments.existsById(id)) throw new NotFoundException("deployment", id);
        return rows.findByDeployment(id).stream().map(r -> toDto(r, id)).toList();
    }

    // ---------------------------------------------------------------- mapping

    private Deployment lockDeployment(String id) {
        return deployments.findForUpdate(id).orElseThrow(() -> new NotFoundException("deployment", id));
    }

    private DeploymentDTO toDto(Deployment d, List<NodeDeploymentStatus> nodeRows) {
        int pending = 0, inFlight = 0, success = 0, failed = 0, skipped = 0;
        for (var r : nodeRows) {
            switch (r.getStatus()) {
                case PENDING -> pending++;
                case DOWNLOADING, INSTALLING -> inFlight++;
                case SUCCESS -> success++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        var progress = new DeploymentDTO.Progress(nodeRows.size(), pending, inFlight, success, failed, skipped);
        return new DeploymentDTO(d.getId(), d.getName(),
                d.getPackageId(), d.getPackageName(), d.getPackageVersion(),
                d.getTargetType(), d.getTargetId(), d.getMode(), d.getStatus(),
                d.getScheduledStart(), d.getScheduledEnd(), d.isMaintenanceWindowOnly(),
                d.getCreatedBy(), d.getCreatedAt(), d.getActivatedAt(), d.getCompletedAt(),
                progress,
                nodeRows.stream().map(r -> toDto(r, d.getId())).toList());
    }

    private NodeStatusDTO toDto(NodeDeploymentStatus r, String deploymentId) {
        return new NodeStatusDTO(deploymentId, r.getNodeId(), r.getStatus(), r.getAttempts(),
                r.getStartedAt(), r.getCompletedAt(), r.getLastAttemptAt(),
                r.getExitCode(), r.getErrorMessage(), r.getOutput());
    }

    private void publishDeployment(DeploymentDTO dto) {
        bus.publish(EventBus.DEPLOYMENTS, "deployment_update", "deployment", dto);
    }

    private void publishNode(NodeStatusDTO dto) {
        bus.publish(EventBus.DEPLOYMENTS, "node_update", "node_status", dto);
    }

    private int retryCeiling() {
        var p = props.deployments();
        return p == null ? 2 : p.retryCeiling();
    }

    private Duration sweepWarnAfter() {
        var p = props.deployments();
        return p == null || p.sweepWarnAfter() == null ? Duration.ofSeconds(20) : p.sweepWarnAfter();
    }

    private Duration inFlightTimeout() {
        var p = props.deployments();
        return p == null || p.inFlightTimeout() == null ? Duration.ofMinutes(30) : p.inFlightTimeout();
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
