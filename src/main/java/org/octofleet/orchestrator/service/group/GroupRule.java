package org.octofleet.orchestrator.service.group;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.service.ValidationException;
import org.octofleet.orchestrator.service.registry.Tags;
import org.octofleet.orchestrator.service.remediation.VersionComparator;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Dynamic group membership predicate:
 * {@code {"operator": "AND|OR", "conditions": [{"field", "op", "value"}]}}.
 * A rule without conditions matches no node.
 */
public record GroupRule(String operator, List<Condition> conditions) {

    public record Condition(String field, String op, String value) {}

    private static final Map<String, Function<Node, String>> FIELDS = Map.of(
            "hostname", Node::getHostname,
            "os_name", Node::getOsName,
            "os_version", Node::getOsVersion,
            "os_build", Node::getOsBuild,
            "agent_version", Node::getAgentVersion,
            "domain", Node::getDomain,
            "tags", Node::getTags,
            "online", n -> String.valueOf(n.isOnline())
    );

    private static final Set<String> OPS = Set.of(
            "equals", "not_equals", "contains", "not_contains", "startswith", "endswith",
            "gte", "lte", "regex", "has_tag");

    public static GroupRule parse(ObjectMapper mapper, String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "dynamic group requires a rule");
        }
        try {
            return mapper.readValue(json, GroupRule.class).validated();
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "malformed group rule: " + e.getOriginalMessage());
        }
    }

    public String toJson(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise group rule", e);
        }
    }

    public GroupRule validated() {
        var opName = operator == null ? "AND" : operator.trim().toUpperCase(Locale.ROOT);
        if (!opName.equals("AND") && !opName.equals("OR")) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "rule operator must be AND or OR: " + operator);
        }
        var conds = conditions == null ? List.<Condition>of() : conditions;
        var normalized = conds.stream().map(GroupRule::validate).toList();
        return new GroupRule(opName, normalized);
    }

    private static Condition validate(Condition c) {
        if (c == null || c.field() == null || c.op() == null) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "rule condition needs field and op");
        }
        var field = c.field().trim().toLowerCase(Locale.ROOT);
        var op = c.op().trim().toLowerCase(Locale.ROOT);
        if (!FIELDS.containsKey(field)) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "unknown rule field: " + c.field());
        }
        if (!OPS.contains(op)) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "unknown rule op: " + c.op());
        }
        var value = c.value() == null ? "" : c.value().trim();
        if (op.equals("regex")) {
            try {
                Pattern.compile(value);
            } catch (PatternSyntaxException e) {
                throw new ValidationException(ErrorCode.BAD_REQUEST, "invalid regex: " + value);
            }
        }
        return new Condition(field, op, value);
    }

    public boolean matches(Node node) {
        if (conditions == null || conditions.isEmpty()) return false;
        boolean any = "OR".equalsIgnoreCase(operator);
        for (var c : conditions) {
            boolean hit = test(c, node);
            if (any && hit) return true;
            if (!any && !hit) return false;
        }
        return !any;
    }

    static boolean test(Condition c, Node node) {
        var want = c.value() == null ? "" : c.value();
        if (c.op().equals("has_tag")) {
            return Tags.fromCsv(node.getTags()).contains(want.toLowerCase(Locale.ROOT));
        }
        var raw = FIELDS.get(c.field()).apply(node);
        if (raw == null) {
            return c.op().equals("not_equals") || c.op().equals("not_contains");
        }
        var have = raw.toLowerCase(Locale.ROOT);
        var w = want.toLowerCase(Locale.ROOT);
        return switch (c.op()) {
            case "equals" -> have.equals(w);
            case "not_equals" -> !have.equals(w);
            case "contains" -> have.contains(w);
            case "not_contains" -> !have.contains(w);
            case "startswith" -> have.startsWith(w);
            case "endswith" -> have.endsWith(w);
            case "gte" -> VersionComparator.INSTANCE.compare(raw, want) >= 0;
            case "lte" -> VersionComparator.INSTANCE.compare(raw, want) <= 0;
            case "regex" -> Pattern.compile(want, Pattern.CASE_INSENSITIVE).matcher(raw).find();
            default -> false;
        };
    }
}
