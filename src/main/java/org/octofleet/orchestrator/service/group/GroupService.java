package org.octofleet.orchestrator.service.group;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.GroupDTO;
import org.octofleet.orchestrator.api.dto.GroupRequest;
import org.octofleet.orchestrator.api.dto.RulePreviewDTO;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.domain.NodeGroup;
import org.octofleet.orchestrator.repo.NodeGroupRepo;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.ValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroupService {

    private final NodeGroupRepo groups;
    private final NodeRepo nodes;
    private final ObjectMapper mapper;

    @Transactional
    public GroupDTO create(GroupRequest r) {
        var name = r.name().trim();
        if (groups.findByNameIgnoreCase(name).isPresent()) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "group name already used: " + name);
        }
        var g = NodeGroup.builder()
                .name(name)
                .description(r.description())
                .dynamic(r.dynamic())
                .build();
        if (r.dynamic()) {
            if (r.rule() == null) throw new ValidationException(ErrorCode.BAD_REQUEST, "dynamic group requires a rule");
            g.setRuleJson(r.rule().validated().toJson(mapper));
        } else {
            g.setMembers(checkedMembers(r.members()));
        }
        groups.save(g);
        log.info("[Groups] created {} '{}' (dynamic={})", g.getId(), name, g.isDynamic());
        return toDto(g, nodes.findAll());
    }

    @Transactional
    public GroupDTO replaceMembers(Long id, List<String> nodeIds) {
        var g = find(id);
        if (g.isDynamic()) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "members of a dynamic group come from its rule");
        }
        g.setMembers(checkedMembers(nodeIds));
        return toDto(g, nodes.findAll());
    }

    @Transactional
    public void delete(Long id) {
        groups.delete(find(id));
    }

    @Transactional(readOnly = true)
    public GroupDTO get(Long id) {
        return toDto(find(id), nodes.findAll());
    }

    @Transactional(readOnly = true)
    public List<GroupDTO> list() {
        var fleet = nodes.findAll();
        return groups.findAllByOrderByNameAsc().stream().map(g -> toDto(g, fleet)).toList();
    }

    @Transactional(readOnly = true)
    public RulePreviewDTO preview(GroupRule rule) {
        var r = rule.validated();
        var fleet = nodes.findAll();
        var matching = fleet.stream()
                .filter(r::matches)
                .sorted(Comparator.comparing(Node::getHostname))
                .map(n -> new RulePreviewDTO.Item(n.getNodeId(), n.getHostname(), n.getOsName(), n.getOsVersion(), n.isOnline()))
                .toList();
        return new RulePreviewDTO(matching.size(), fleet.size(), matching);
    }

    /** Current membership: stored list for static groups, rule evaluation for dynamic ones. */
    @Transactional(readOnly = true)
    public List<String> members(Long id) {
        return members(find(id), nodes.findAll());
    }

    List<String> members(NodeGroup g, Collection<Node> fleet) {
        if (g.isDynamic()) {
            var rule = GroupRule.parse(mapper, g.getRuleJson());
            return fleet.stream().filter(rule::matches).map(Node::getNodeId).sorted().toList();
        }
        var known = new LinkedHashSet<String>();
        fleet.forEach(n -> known.add(n.getNodeId()));
        return g.getMembers().stream().filter(known::contains).sorted().toList();
    }

    private NodeGroup find(Long id) {
        return groups.findById(id).orElseThrow(() -> new NotFoundException("group", id));
    }

    private Set<String> checkedMembers(Collection<String> ids) {
        var out = new LinkedHashSet<String>();
        if (ids == null) return out;
        var unknown = new ArrayList<String>();
        for (var raw : ids) {
            if (raw == null || raw.isBlank()) continue;
            var id = raw.trim();
            if (nodes.existsByNodeId(id)) out.add(id); else unknown.add(id);
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "unknown node(s): " + String.join(", ", unknown));
        }
        return out;
    }

    private GroupDTO toDto(NodeGroup g, Collection<Node> fleet) {
        var members = members(g, fleet);
        var rule = g.isDynamic() ? GroupRule.parse(mapper, g.getRuleJson()) : null;
        return new GroupDTO(g.getId(), g.getName(), g.getDescription(), g.isDynamic(), rule,
                members, members.size(), g.getCreatedAt());
    }
}
