package org.octofleet.orchestrator.service.remediation;

import org.octofleet.orchestrator.domain.RemediationJob;
import org.octofleet.orchestrator.domain.RemediationPackage;

import java.util.Locale;
import java.util.Optional;

/** Command lines sent to the agent for a fix and for its rollback. */
public final class FixCommandBuilder {

    private FixCommandBuilder() {}

    public static String fixCommand(RemediationJob job, RemediationPackage pkg) {
        var explicit = pkg.getFixCommand();
        var software = job.getSoftwareName();
        var s = software.toLowerCase(Locale.ROOT);
        return switch (pkg.getFixMethod()) {
            case WINGET -> notBlank(explicit) ? explicit : wingetId(s)
                    .map(id -> "winget upgrade " + id + " --silent --accept-source-agreements")
                    .orElse("winget upgrade --name \"" + software + "\" --silent --accept-source-agreements");
            case CHOCO -> notBlank(explicit) ? explicit
                    : isSevenZip(s) ? "choco upgrade 7zip -y" : "choco upgrade " + software + " -y";
            case SCRIPT -> notBlank(explicit) ? explicit : "echo \"No script defined\"";
            case PACKAGE -> "DEPLOY_PACKAGE:" + pkg.getSoftwarePackageId();
        };
    }

    /** Empty when the fix method cannot be undone. */
    public static Optional<String> rollbackCommand(RemediationJob job, RemediationPackage pkg) {
        if (notBlank(pkg.getRollbackCommand())) return Optional.of(pkg.getRollbackCommand());
        var software = job.getSoftwareName();
        var version = job.getSoftwareVersion();
        return switch (pkg.getFixMethod()) {
            case WINGET -> notBlank(version)
                    ? Optional.of("winget install --name \"" + software + "\" --version " + version
                            + " --force --silent --accept-source-agreements")
                    : Optional.empty();
            case CHOCO -> notBlank(version)
                    ? Optional.of("choco install " + (isSevenZip(software.toLowerCase(Locale.ROOT)) ? "7zip" : software)
                            + " --version " + version + " --allow-downgrade -y")
                    : Optional.empty();
            case PACKAGE -> Optional.of("ROLLBACK_PACKAGE:" + pkg.getSoftwarePackageId());
            case SCRIPT -> Optional.empty();
        };
    }

    private static Optional<String> wingetId(String lowerName) {
        if (isSevenZip(lowerName)) return Optional.of("7zip.7zip");
        if (lowerName.contains("chrome")) return Optional.of("Google.Chrome");
        if (lowerName.contains("firefox")) return Optional.of("Mozilla.Firefox");
        return Optional.empty();
    }

    private static boolean isSevenZip(String lowerName) {
        return lowerName.contains("7-zip") || lowerName.contains("7zip");
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
