package org.octofleet.orchestrator.api.dto;

import java.util.List;

public record ActiveWindowsDTO(String nodeId, boolean inWindow, List<MaintenanceWindowDTO> windows) {}
