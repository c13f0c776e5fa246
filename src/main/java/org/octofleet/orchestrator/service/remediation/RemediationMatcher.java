package org.octofleet.orchestrator.service.remediation;

import org.octofleet.orchestrator.domain.RemediationPackage;
import org.octofleet.orchestrator.domain.RemediationRule;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Picks the rule and the fix package for a finding. No I/O. */
public final class RemediationMatcher {

    private RemediationMatcher() {}

    /**
     * Most specific enabled rule: severity threshold met and pattern (if any) found in the
     * software name. Longer patterns are more specific; a rule without pattern is the
     * least specific. Ties go to the lowest id.
     */
    public static Optional<RemediationRule> pickRule(Finding f, List<RemediationRule> rules) {
        return rules.stream()
                .filter(RemediationRule::isEnabled)
                .filter(r -> f.severity() != null && f.severity().meets(r.getMinSeverity()))
                .filter(r -> patternMatches(r.getSoftwarePattern(), f.softwareName()))
                .min(Comparator.comparingInt((RemediationRule r) -> -specificity(r.getSoftwarePattern()))
                        .thenComparing(RemediationRule::getId, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    /**
     * Enabled package whose target names the software and whose fixed version is newer
     * than what is installed. Longest target wins, then lowest id.
     */
    public static Optional<RemediationPackage> pickPackage(Finding f, List<RemediationPackage> packages) {
        return packages.stream()
                .filter(RemediationPackage::isEnabled)
                .filter(p -> softwareMatches(p.getTargetSoftware(), f.softwareName()))
                .filter(p -> p.getMinFixedVersion() == null || p.getMinFixedVersion().isBlank()
                        || VersionComparator.isOlder(f.softwareVersion(), p.getMinFixedVersion()))
                .min(Comparator.comparingInt((RemediationPackage p) -> -p.getTargetSoftware().length())
                        .thenComparing(RemediationPackage::getId, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    /** Case-insensitive containment in either direction. */
    public static boolean softwareMatches(String target, String software) {
        if (target == null || software == null || target.isBlank() || software.isBlank()) return false;
        var t = target.trim().toLowerCase(Locale.ROOT);
        var s = software.trim().toLowerCase(Locale.ROOT);
        return s.contains(t) || t.contains(s);
    }

    static boolean patternMatches(String pattern, String software) {
        if (pattern == null || pattern.isBlank()) return true;
        if (software == null) return false;
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(software).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static int specificity(String pattern) {
        return pattern == null || pattern.isBlank() ? -1 : pattern.length();
    }
}
