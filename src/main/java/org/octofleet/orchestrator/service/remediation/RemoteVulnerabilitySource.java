package org.octofleet.orchestrator.service.remediation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Pulls findings from an external vulnerability service:
 * {@code GET {base-url}/findings?severity=CRITICAL,HIGH}, answering either a JSON
 * array or {@code {"findings": [...]}} with snake_case fields.
 */
@Slf4j
public class RemoteVulnerabilitySource implements VulnerabilitySource {

    private final WebClient client;
    private final AppProps.VulnerabilityProps props;

    public RemoteVulnerabilitySource(WebClient client, AppProps.VulnerabilityProps props) {
        this.client = client;
        this.props = props;
        log.info("[VulnFeed] using remote findings at {}", props.baseUrl());
    }

    @Override
    public List<Finding> findings(Set<Severity> severities) {
        var query = severities == null || severities.isEmpty() ? ""
                : "?severity=" + severities.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
        var url = props.baseUrl().replaceAll("/+$", "") + "/findings" + query;
        var spec = client.get().uri(url)
                .headers(h -> {
                    if (props.token() != null && !props.token().isBlank()) h.setBearerAuth(props.token());
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve();
        var body = handle(spec).block();
        return parse(body, severities);
    }

    /** Central error mapping: any non-2xx, timeout or connect failure is UPSTREAM_UNAVAILABLE. */
    private Mono<JsonNode> handle(WebClient.ResponseSpec spec) {
        var timeout = props.timeout() == null ? Duration.ofSeconds(20) : props.timeout();
        return spec
                .onStatus(s -> !s.is2xxSuccessful(),
                        r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new UpstreamUnavailableException(ErrorCode.UPSTREAM_UNAVAILABLE,
                                        "vulnerability feed error " + r.statusCode().value()
                                                + (body.isBlank() ? "" : " -> " + body)))
                )
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .retryWhen(
                        Retry.backoff(1, Duration.ofMillis(400)).jitter(0.4)
                                .filter(ex -> ex instanceof WebClientRequestException)
                                .onRetryExhaustedThrow((r, signal) -> signal.failure())
                )
                .onErrorMap(TimeoutException.class,
                        e -> new UpstreamUnavailableException(ErrorCode.TIMEOUT, "vulnerability feed timed out after " + timeout))
                .onErrorMap(WebClientRequestException.class,
                        e -> new UpstreamUnavailableException(ErrorCode.UPSTREAM_UNAVAILABLE, "vulnerability feed unreachable: " + e.getMessage()));
    }

    static List<Finding> parse(JsonNode body, Set<Severity> severities) {
        var out = new ArrayList<Finding>();
        if (body == null) return out;
        var items = body.isArray() ? body : body.path("findings");
        for (var n : items) {
            var sev = n.path("severity").asText("");
            Severity severity;
            try {
                severity = Severity.parse(sev);
            } catch (IllegalArgumentException e) {
                log.debug("[VulnFeed] skipping finding with severity '{}'", sev);
                continue;
            }
            if (severities != null && !severities.isEmpty() && !severities.contains(severity)) continue;
            var nodeId = n.path("node_id").asText("");
            var cve = n.path("cve_id").asText("");
            var software = n.path("software_name").asText("");
            if (nodeId.isBlank() || cve.isBlank() || software.isBlank()) continue;
            out.add(new Finding(nodeId, cve.toUpperCase(Locale.ROOT), software,
                    n.hasNonNull("software_version") ? n.get("software_version").asText() : null,
                    severity,
                    n.hasNonNull("cvss_score") ? n.get("cvss_score").asDouble() : null));
        }
        return out;
    }
}
