package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.NodeDTO;
import org.octofleet.orchestrator.api.dto.UpdateNodeDTO;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.registry.NodeRegistryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Node read APIs plus tag management.
 * Status (UP/STALE/DOWN) is derived from last_seen on every read.
 */
@RestController
@RequestMapping("/api/v1/nodes")
@RequiredArgsConstructor
public class NodeController {
    private final NodeRegistryService registry;
    private final AuditService audit;

    /**
     * @param q optional hostname/node id filter (contains, case-insensitive)
     * @param online optional online flag filter
     */
    @GetMapping
    public List<NodeDTO> list(@RequestParam(value = "q", required = false) String q,
                              @RequestParam(value = "online", required = false) Boolean online) {
        return registry.list(q, online);
    }

    @GetMapping("/{nodeId}")
    public NodeDTO get(@PathVariable String nodeId) {
        return registry.get(nodeId);
    }

    @PatchMapping("/{nodeId}")
    public NodeDTO update(@PathVariable String nodeId, @Valid @RequestBody UpdateNodeDTO body, HttpServletRequest req) {
        var dto = registry.updateTags(nodeId, body.tags());
        audit.log(req, "node.tags", "node", nodeId, String.join(",", dto.tags()));
        return dto;
    }
}
