package org.octofleet.orchestrator.api.dto;

import org.octofleet.orchestrator.service.group.GroupRule;

import java.time.Instant;
import java.util.List;

public record GroupDTO(
        Long id, String name, String description,
        boolean dynamic, GroupRule rule,
        List<String> members, int memberCount,
        Instant createdAt
) {}
