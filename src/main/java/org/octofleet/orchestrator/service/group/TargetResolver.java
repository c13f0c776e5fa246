package org.octofleet.orchestrator.service.group;

import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.domain.TargetType;
import org.octofleet.orchestrator.repo.NodeGroupRepo;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.ValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Turns a target selector into a concrete, sorted node-id list at call time. */
@Service
@RequiredArgsConstructor
public class TargetResolver {

    private final NodeRepo nodes;
    private final NodeGroupRepo groups;
    private final GroupService groupService;

    @Transactional(readOnly = true)
    public List<String> resolve(TargetType type, String targetId) {
        if (type == null) throw ValidationException.invalidTarget("target_type is required");
        var resolved = switch (type) {
            case NODE -> resolveNode(targetId);
            case GROUP -> resolveGroup(targetId);
            case ALL -> nodes.findAll().stream().map(Node::getNodeId).sorted().toList();
        };
        if (resolved.isEmpty()) {
            throw ValidationException.invalidTarget("target resolves to no nodes: " + type.wire()
                    + (targetId == null ? "" : " " + targetId));
        }
        return resolved;
    }

    /** Does the selector cover this node right now? Used for maintenance window targeting. */
    @Transactional(readOnly = true)
    public boolean covers(TargetType type, String targetId, String nodeId) {
        if (type == null || type == TargetType.ALL) return true;
        if (type == TargetType.NODE) return nodeId.equals(targetId);
        var gid = parseGroupId(targetId);
        return groups.findById(gid)
                .map(g -> groupService.members(g, nodes.findAll()).contains(nodeId))
                .orElse(false);
    }

    private List<String> resolveNode(String targetId) {
        if (targetId == null || targetId.isBlank()) throw ValidationException.invalidTarget("target_id is required for a node target");
        var id = targetId.trim();
        if (!nodes.existsByNodeId(id)) throw ValidationException.invalidTarget("unknown node: " + id);
        return List.of(id);
    }

    private List<String> resolveGroup(String targetId) {
        var gid = parseGroupId(targetId);
        var g = groups.findById(gid).orElseThrow(() -> ValidationException.invalidTarget("unknown group: " + targetId));
        return groupService.members(g, nodes.findAll());
    }

    private static Long parseGroupId(String targetId) {
        if (targetId == null || targetId.isBlank()) throw ValidationException.invalidTarget("target_id is required for a group target");
        try {
            return Long.parseLong(targetId.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidTarget("group id must be numeric: " + targetId);
        }
    }
}
