package org.octofleet.orchestrator.api.dto;

import java.time.Instant;
import java.util.List;

public record NodeDTO(
        String nodeId, String hostname,
        String osName, String osVersion, String osBuild,
        String agentVersion, String domain, List<String> tags,
        boolean online, String status,
        Instant firstSeen, Instant lastSeen
) {}
