package org.octofleet.orchestrator.service.remediation;

import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.domain.FixMethod;
import org.octofleet.orchestrator.domain.RemediationPackage;
import org.octofleet.orchestrator.domain.RemediationRule;
import org.octofleet.orchestrator.domain.Severity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationMatcherTest {

    private static Finding finding(String software, String version, Severity severity) {
        return new Finding("n1", "CVE-2024-0001", software, version, severity, 9.1);
    }

    private static RemediationRule rule(long id, Severity min, String pattern) {
        return RemediationRule.builder().id(id).name("r" + id).minSeverity(min)
                .softwarePattern(pattern).enabled(true).requireApproval(true).build();
    }

    private static RemediationPackage pkg(long id, String target, String minFixed) {
        return RemediationPackage.builder().id(id).name("p" + id).targetSoftware(target)
                .minFixedVersion(minFixed).fixMethod(FixMethod.WINGET).enabled(true).build();
    }

    @Test
    void longestPatternWinsOverGenericRule() {
        var rules = List.of(rule(1, Severity.HIGH, null), rule(2, Severity.HIGH, "7-zip"), rule(3, Severity.HIGH, "zip"));

        var picked = RemediationMatcher.pickRule(finding("7-Zip 23.01 (x64)", "23.01", Severity.CRITICAL), rules);

        assertThat(picked).get().extracting(RemediationRule::getId).isEqualTo(2L);
    }

    @Test
    void ruleTiesGoToLowestId() {
        var rules = List.of(rule(7, Severity.LOW, "chrome"), rule(4, Severity.LOW, "chrome"));

        assertThat(RemediationMatcher.pickRule(finding("Google Chrome", "120.0", Severity.HIGH), rules))
                .get().extracting(RemediationRule::getId).isEqualTo(4L);
    }

    @Test
    void severityBelowThresholdMatchesNoRule() {
        var rules = List.of(rule(1, Severity.HIGH, null));

        assertThat(RemediationMatcher.pickRule(finding("Firefox", "118", Severity.MEDIUM), rules)).isEmpty();
    }

    @Test
    void disabledRulesAndBadPatternsAreIgnored() {
        var off = rule(1, Severity.LOW, null);
        off.setEnabled(false);
        var broken = rule(2, Severity.LOW, "([");

        assertThat(RemediationMatcher.pickRule(finding("Firefox", "118", Severity.HIGH), List.of(off, broken))).isEmpty();
    }

    @Test
    void packageNeedsNewerFixedVersion() {
        var p = pkg(1, "7-Zip", "24.07");

        assertThat(RemediationMatcher.pickPackage(finding("7-Zip 23.01 (x64)", "23.01", Severity.HIGH), List.of(p))).isPresent();
        assertThat(RemediationMatcher.pickPackage(finding("7-Zip 24.08 (x64)", "24.08", Severity.HIGH), List.of(p))).isEmpty();
    }

    @Test
    void mostSpecificTargetWins() {
        var generic = pkg(1, "Chrome", null);
        var specific = pkg(2, "Google Chrome", null);

        assertThat(RemediationMatcher.pickPackage(finding("Google Chrome", "119.0", Severity.HIGH), List.of(generic, specific)))
                .get().extracting(RemediationPackage::getId).isEqualTo(2L);
    }

    @Test
    void softwareMatchIsCaseInsensitiveBothWays() {
        assertThat(RemediationMatcher.softwareMatches("7-zip", "7-Zip 23.01 (x64)")).isTrue();
        assertThat(RemediationMatcher.softwareMatches("Mozilla Firefox ESR", "firefox")).isTrue();
        assertThat(RemediationMatcher.softwareMatches("Notepad++", "Firefox")).isFalse();
        assertThat(RemediationMatcher.softwareMatches("", "Firefox")).isFalse();
    }
}
