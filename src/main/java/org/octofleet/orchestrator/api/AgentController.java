package org.octofleet.orchestrator.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.*;
import org.octofleet.orchestrator.service.agent.AgentCommand;
import org.octofleet.orchestrator.service.agent.PollingAgentGateway;
import org.octofleet.orchestrator.service.deployment.DeploymentOrchestrator;
import org.octofleet.orchestrator.service.live.LiveSessionBroker;
import org.octofleet.orchestrator.service.registry.NodeRegistryService;
import org.octofleet.orchestrator.service.remediation.RemediationPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Agent-facing surface: enrollment, heartbeats, command polling and result reports.
 * A command poll counts as a heartbeat.
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
public class AgentController {
    private final NodeRegistryService registry;
    private final PollingAgentGateway gateway;
    private final DeploymentOrchestrator deployments;
    private final RemediationPipeline remediation;
    private final LiveSessionBroker broker;

    @PostMapping("/enroll")
    public NodeDTO enroll(@Valid @RequestBody EnrollRequest body) {
        return registry.enroll(body);
    }

    @PostMapping("/{nodeId}/heartbeat")
    public NodeDTO heartbeat(@PathVariable String nodeId, @Valid @RequestBody(required = false) HeartbeatRequest body) {
        return registry.heartbeat(nodeId, body == null ? null : body.agentVersion());
    }

    @GetMapping("/{nodeId}/commands")
    public List<AgentCommand> commands(@PathVariable String nodeId,
                                       @RequestParam(value = "max", required = false, defaultValue = "20") int max) {
        registry.heartbeat(nodeId, null);
        return gateway.drain(nodeId, max);
    }

    @PostMapping("/{nodeId}/deployments/{deploymentId}/status")
    public NodeStatusDTO deploymentStatus(@PathVariable String nodeId, @PathVariable String deploymentId,
                                          @Valid @RequestBody NodeResultReport body) {
        return deployments.reportNodeResult(deploymentId, nodeId, body);
    }

    @PostMapping("/{nodeId}/remediation/jobs/{jobId}/result")
    public RemediationJobDTO jobResult(@PathVariable String nodeId, @PathVariable Long jobId,
                                       @Valid @RequestBody JobResultReport body) {
        return remediation.reportResult(jobId, nodeId, body);
    }

    @PostMapping("/sessions/{sessionId}/frames")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Integer> frames(@PathVariable String sessionId, @Valid @RequestBody FramesPush body) {
        return Map.of("accepted", broker.pushFrames(sessionId, body.frames()));
    }
}
