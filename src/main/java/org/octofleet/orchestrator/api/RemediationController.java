package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.*;
import org.octofleet.orchestrator.domain.JobStatus;
import org.octofleet.orchestrator.security.ApiKeyFilter;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.events.EventBus;
import org.octofleet.orchestrator.service.events.SseFanout;
import org.octofleet.orchestrator.service.remediation.RemediationCatalogService;
import org.octofleet.orchestrator.service.remediation.RemediationPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * Remediation: scan, approval gate, execution and the package/rule catalog.
 * Job commands return the job snapshot after the transition; an offline node shows up as
 * a failed job with reason NODE_OFFLINE, not as an HTTP error.
 */
@RestController
@RequestMapping("/api/v1/remediation")
@RequiredArgsConstructor
public class RemediationController {
    private final RemediationPipeline pipeline;
    private final RemediationCatalogService catalog;
    private final SseFanout fanout;
    private final AuditService audit;

    @PostMapping("/scan")
    public ScanResult scan(@RequestBody(required = false) ScanRequest body, HttpServletRequest req) {
        var filter = body == null ? null : body.severityFilter();
        boolean dryRun = body != null && body.dryRun();
        var result = pipeline.scan(filter, dryRun);
        if (!dryRun) {
            audit.log(req, "remediation.scan", "scan", null,
                    "scanned=%d created=%d".formatted(result.scanned(), result.jobsCreated()));
        }
        return result;
    }

    @GetMapping("/summary")
    public RemediationSummaryDTO summary() {
        return pipeline.summary();
    }

    @GetMapping("/live")
    public SseEmitter live() {
        return fanout.subscribe(EventBus.REMEDIATION);
    }

    // ---------- jobs ----------

    @GetMapping("/jobs")
    public List<RemediationJobDTO> jobs(@RequestParam(value = "status", required = false) String status,
                                        @RequestParam(value = "node_id", required = false) String nodeId,
                                        @RequestParam(value = "limit", required = false, defaultValue = "100") int limit,
                                        @RequestParam(value = "offset", required = false, defaultValue = "0") int offset) {
        return pipeline.list(status == null ? null : JobStatus.fromWire(status), nodeId, limit, offset);
    }

    @GetMapping("/jobs/{id}")
    public RemediationJobDTO job(@PathVariable Long id) {
        return pipeline.get(id);
    }

    @PostMapping("/jobs/approve")
    public Map<String, Integer> approveAll(@Valid @RequestBody ApproveRequest body, HttpServletRequest req) {
        int n = pipeline.approveAll(body.jobIds(), ApiKeyFilter.actor(req));
        audit.log(req, "remediation.approve_bulk", "job", null, n + " of " + body.jobIds().size());
        return Map.of("approved", n);
    }

    @PostMapping("/jobs/{id}/approve")
    public RemediationJobDTO approve(@PathVariable Long id, HttpServletRequest req) {
        var job = pipeline.approve(id, ApiKeyFilter.actor(req));
        audit.log(req, "remediation.approve", "job", String.valueOf(id), null);
        return job;
    }

    @PostMapping("/jobs/{id}/execute")
    public RemediationJobDTO execute(@PathVariable Long id, HttpServletRequest req) {
        var job = pipeline.execute(id);
        audit.log(req, "remediation.execute", "job", String.valueOf(id), job.status().wire());
        return job;
    }

    @PostMapping("/jobs/{id}/retry")
    public RemediationJobDTO retry(@PathVariable Long id, HttpServletRequest req) {
        var job = pipeline.retry(id);
        audit.log(req, "remediation.retry", "job", String.valueOf(id), null);
        return job;
    }

    @PostMapping("/jobs/{id}/rollback")
    public RemediationJobDTO rollback(@PathVariable Long id, HttpServletRequest req) {
        var job = pipeline.rollback(id);
        audit.log(req, "remediation.rollback", "job", String.valueOf(id), null);
        return job;
    }

    @PostMapping("/jobs/{id}/skip")
    public RemediationJobDTO skip(@PathVariable Long id, HttpServletRequest req) {
        var job = pipeline.skip(id);
        audit.log(req, "remediation.skip", "job", String.valueOf(id), null);
        return job;
    }

    // ---------- catalog ----------

    @GetMapping("/packages")
    public List<RemediationPackageDTO> packages() {
        return catalog.listPackages();
    }

    @PostMapping("/packages")
    @ResponseStatus(HttpStatus.CREATED)
    public RemediationPackageDTO createPackage(@Valid @RequestBody RemediationPackageRequest body, HttpServletRequest req) {
        var p = catalog.createPackage(body);
        audit.log(req, "remediation.package.create", "remediation_package", String.valueOf(p.id()), p.name());
        return p;
    }

    @PutMapping("/packages/{id}")
    public RemediationPackageDTO updatePackage(@PathVariable Long id, @Valid @RequestBody RemediationPackageRequest body,
                                               HttpServletRequest req) {
        var p = catalog.updatePackage(id, body);
        audit.log(req, "remediation.package.update", "remediation_package", String.valueOf(id), p.name());
        return p;
    }

    @DeleteMapping("/packages/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deletePackage(@PathVariable Long id, HttpServletRequest req) {
        catalog.deletePackage(id);
        audit.log(req, "remediation.package.delete", "remediation_package", String.valueOf(id), null);
    }

    @GetMapping("/rules")
    public List<RemediationRuleDTO> rules() {
        return catalog.listRules();
    }

    @PostMapping("/rules")
    @ResponseStatus(HttpStatus.CREATED)
    public RemediationRuleDTO createRule(@Valid @RequestBody RemediationRuleRequest body, HttpServletRequest req) {
        var r = catalog.createRule(body);
        audit.log(req, "remediation.rule.create", "remediation_rule", String.valueOf(r.id()), r.name());
        return r;
    }

    @PutMapping("/rules/{id}")
    public RemediationRuleDTO updateRule(@PathVariable Long id, @Valid @RequestBody RemediationRuleRequest body,
                                         HttpServletRequest req) {
        var r = catalog.updateRule(id, body);
        audit.log(req, "remediation.rule.update", "remediation_rule", String.valueOf(id), r.name());
        return r;
    }

    @DeleteMapping("/rules/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRule(@PathVariable Long id, HttpServletRequest req) {
        catalog.deleteRule(id);
        audit.log(req, "remediation.rule.delete", "remediation_rule", String.valueOf(id), null);
    }
}
