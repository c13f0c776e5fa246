package org.octofleet.orchestrator.service.group;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.service.ValidationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupRuleTest {

    private static Node node(String host, String os, String osVersion, String tags, boolean online) {
        return Node.builder().nodeId(host.toLowerCase()).hostname(host).osName(os).osVersion(osVersion)
                .agentVersion("0.4.2").tags(tags).online(online).build();
    }

    private static GroupRule.Condition c(String field, String op, String value) {
        return new GroupRule.Condition(field, op, value);
    }

    @Test
    void andRequiresEveryCondition() {
        var rule = new GroupRule("AND", List.of(
                c("os_name", "contains", "server"),
                c("os_version", "gte", "10.0.17763"))).validated();

        assertThat(rule.matches(node("DC01", "Windows Server 2022", "10.0.20348", null, true))).isTrue();
        assertThat(rule.matches(node("DC02", "Windows Server 2016", "10.0.14393", null, true))).isFalse();
        assertThat(rule.matches(node("PC01", "Windows 11", "10.0.22631", null, true))).isFalse();
    }

    @Test
    void orNeedsOneCondition() {
        var rule = new GroupRule("or", List.of(
                c("hostname", "startswith", "web"),
                c("tags", "has_tag", "DMZ"))).validated();

        assertThat(rule.matches(node("WEB01", "Linux", "6.1", null, true))).isTrue();
        assertThat(rule.matches(node("APP01", "Linux", "6.1", "prod,dmz", true))).isTrue();
        assertThat(rule.matches(node("APP02", "Linux", "6.1", "prod", true))).isFalse();
    }

    @Test
    void emptyRuleMatchesNothing() {
        var rule = new GroupRule("AND", List.of()).validated();
        assertThat(rule.matches(node("A", "x", "1", null, true))).isFalse();
    }

    @Test
    void regexIsCaseInsensitiveFind() {
        var rule = new GroupRule("AND", List.of(c("hostname", "regex", "^sql\\d+$"))).validated();
        assertThat(rule.matches(node("SQL01", "x", "1", null, true))).isTrue();
        assertThat(rule.matches(node("SQLX", "x", "1", null, true))).isFalse();
    }

    @Test
    void missingFieldOnlySatisfiesNegations() {
        var n = node("A", "x", "1", null, true);
        assertThat(GroupRule.test(c("domain", "not_equals", "corp"), n)).isTrue();
        assertThat(GroupRule.test(c("domain", "equals", "corp"), n)).isFalse();
    }

    @Test
    void onlineFieldComparesAsText() {
        var rule = new GroupRule("AND", List.of(c("online", "equals", "true"))).validated();
        assertThat(rule.matches(node("A", "x", "1", null, true))).isTrue();
        assertThat(rule.matches(node("B", "x", "1", null, false))).isFalse();
    }

    @Test
    void validationRejectsUnknownFieldOpAndBadRegex() {
        assertThatThrownBy(() -> new GroupRule("AND", List.of(c("owner", "equals", "x"))).validated())
                .isInstanceOf(ValidationException.class).hasMessageContaining("unknown rule field");
        assertThatThrownBy(() -> new GroupRule("AND", List.of(c("hostname", "like", "x"))).validated())
                .isInstanceOf(ValidationException.class).hasMessageContaining("unknown rule op");
        assertThatThrownBy(() -> new GroupRule("AND", List.of(c("hostname", "regex", "(["))).validated())
                .isInstanceOf(ValidationException.class).hasMessageContaining("invalid regex");
        assertThatThrownBy(() -> new GroupRule("XOR", List.of()).validated())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void survivesJsonRoundTrip() {
        var mapper = new ObjectMapper();
        var rule = new GroupRule("AND", List.of(c("hostname", "contains", "web"))).validated();

        assertThat(GroupRule.parse(mapper, rule.toJson(mapper))).isEqualTo(rule);
    }
}
