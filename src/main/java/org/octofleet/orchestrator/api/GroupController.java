package org.octofleet.orchestrator.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.api.dto.GroupDTO;
import org.octofleet.orchestrator.api.dto.GroupRequest;
import org.octofleet.orchestrator.api.dto.MembersRequest;
import org.octofleet.orchestrator.api.dto.RulePreviewDTO;
import org.octofleet.orchestrator.service.audit.AuditService;
import org.octofleet.orchestrator.service.group.GroupRule;
import org.octofleet.orchestrator.service.group.GroupService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/groups")
@RequiredArgsConstructor
public class GroupController {
    private final GroupService groups;
    private final AuditService audit;

    @GetMapping
    public List<GroupDTO> list() {
        return groups.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GroupDTO create(@Valid @RequestBody GroupRequest body, HttpServletRequest req) {
        var g = groups.create(body);
        audit.log(req, "group.create", "group", String.valueOf(g.id()), g.name());
        return g;
    }

    @GetMapping("/{id}")
    public GroupDTO get(@PathVariable Long id) {
        return groups.get(id);
    }

    @PutMapping("/{id}/members")
    public GroupDTO members(@PathVariable Long id, @Valid @RequestBody MembersRequest body, HttpServletRequest req) {
        var g = groups.replaceMembers(id, body.nodeIds());
        audit.log(req, "group.members", "group", String.valueOf(id), String.join(",", body.nodeIds()));
        return g;
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id, HttpServletRequest req) {
        groups.delete(id);
        audit.log(req, "group.delete", "group", String.valueOf(id), null);
    }

    @PostMapping("/preview-rule")
    public RulePreviewDTO preview(@RequestBody GroupRule rule) {
        return groups.preview(rule);
    }
}
