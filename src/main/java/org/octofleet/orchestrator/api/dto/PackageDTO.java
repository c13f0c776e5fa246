package org.octofleet.orchestrator.api.dto;

import java.time.Instant;

public record PackageDTO(
        Long id, String name, String version, String displayName,
        String installerUrl, String sha256,
        String installCommand, String uninstallCommand,
        boolean active, Instant createdAt
) {}
