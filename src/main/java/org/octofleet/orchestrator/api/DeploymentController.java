package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.CreateDeploymentRequest;
import org.octofleet.orchestrator.api.dto.DeploymentDTO;
import org.octofleet.orchestrator.api.dto.DeploymentPatch;
import org.octofleet.orchestrator.api.dto.NodeStatusDTO;
import org.octofleet.orchestrator.domain.DeploymentStatus;
import org.octofleet.orchestrator.security.ApiKeyFilter;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.deployment.DeploymentOrchestrator;
import org.octofleet.orchestrator.service.events.EventBus;
import org.octofleet.orchestrator.service.events.SseFanout;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Deployment commands and read models. Every command returns the post-transition
 * snapshot; the same snapshot is pushed on /deployments/live.
 */
@RestController
@RequestMapping("/api/v1/deployments")
@RequiredArgsConstructor
public class DeploymentController {
    private final DeploymentOrchestrator orchestrator;
    private final SseFanout fanout;
    private final AuditService audit;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DeploymentDTO create(@Valid @RequestBody CreateDeploymentRequest body, HttpServletRequest req) {
        var d = orchestrator.create(body, ApiKeyFilter.actor(req));
        audit.log(req, "deployment.create", "deployment", d.id(),
                "%s %s -> %s %s (%d nodes)".formatted(d.packageName(), d.packageVersion(),
                        d.targetType().wire(), d.targetId() == null ? "" : d.targetId(), d.progress().total()));
        return d;
    }

    /**
     * @param status optional status filter
     * @param limit page size (default 100, max 500)
     */
    @GetMapping
    public List<DeploymentDTO> list(@RequestParam(value = "status", required = false) String status,
                                    @RequestParam(value = "limit", required = false, defaultValue = "100") int limit,
                                    @RequestParam(value = "offset", required = false, defaultValue = "0") int offset) {
        return orchestrator.list(status == null ? null : DeploymentStatus.fromWire(status), limit, offset);
    }

    @GetMapping("/live")
    public SseEmitter live() {
        return fanout.subscribe(EventBus.DEPLOYMENTS);
    }

    @GetMapping("/{id}")
    public DeploymentDTO get(@PathVariable String id) {
        return orchestrator.get(id);
    }

    /** Body {status} with status one of active, paused, cancelled. */
    @PatchMapping("/{id}")
    public DeploymentDTO patch(@PathVariable String id, @Valid @RequestBody DeploymentPatch body, HttpServletRequest req) {
        var d = orchestrator.changeStatus(id, body.status());
        audit.log(req, "deployment.status", "deployment", id, body.status().wire());
        return d;
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, HttpServletRequest req) {
        orchestrator.delete(id);
        audit.log(req, "deployment.delete", "deployment", id, null);
    }

    @GetMapping("/{id}/nodes")
    public List<NodeStatusDTO> nodes(@PathVariable String id) {
        return orchestrator.nodes(id);
    }

    @PostMapping("/{id}/nodes/{nodeId}/retry")
    public NodeStatusDTO retry(@PathVariable String id, @PathVariable String nodeId, HttpServletRequest req) {
        var row = orchestrator.retryNode(id, nodeId);
        audit.log(req, "deployment.retry", "deployment", id, nodeId);
        return row;
    }
}
