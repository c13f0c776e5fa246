package org.octofleet.orchestrator.api.dto;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PackageRequest(
        @NotBlank @Size(max = 128) String name,
        @NotBlank @Size(max = 64) String version,
        @Nullable @Size(max = 256) String displayName,
        @Nullable @Size(max = 1024) String installerUrl,
        @Nullable @Size(max = 128) String sha256,
        @Nullable @Size(max = 2000) String installCommand,
        @Nullable @Size(max = 2000) String uninstallCommand,
        @Nullable Boolean active
) {}
