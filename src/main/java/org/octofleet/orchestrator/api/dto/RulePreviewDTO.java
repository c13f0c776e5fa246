package org.octofleet.orchestrator.api.dto;

import java.util.List;

public record RulePreviewDTO(int matchingCount, int totalNodes, List<Item> matching) {
    public record Item(String nodeId, String hostname, String osName, String osVersion, boolean online) {}
}
