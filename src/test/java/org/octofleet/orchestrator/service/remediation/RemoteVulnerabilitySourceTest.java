package org.octofleet.orchestrator.service.remediation;

import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.Severity;
import org.octofleet.orchestrator.service.UpstreamUnavailableException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteVulnerabilitySourceTest {

    private static final AppProps.VulnerabilityProps FEED =
            new AppProps.VulnerabilityProps("http://feed.local/api/", "s3cret", false, Duration.ofMillis(300));

    private static RemoteVulnerabilitySource source(ExchangeFunction exchange) {
        return new RemoteVulnerabilitySource(WebClient.builder().exchangeFunction(exchange).build(), FEED);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void readsWrappedFindingsAndSendsFilterAndToken() {
        var seen = new AtomicReference<ClientRequest>();
        var src = source(req -> {
            seen.set(req);
            return json(HttpStatus.OK, """
                    {"findings":[
                      {"node_id":"ws-01","cve_id":"cve-2024-1001","software_name":"7-Zip","software_version":"19.00","severity":"high","cvss_score":7.8},
                      {"node_id":"ws-02","cve_id":"CVE-2024-1002","software_name":"Google Chrome","severity":"LOW"},
                      {"node_id":"ws-03","cve_id":"CVE-2024-1003","software_name":"Zoom","severity":"unknown"},
                      {"node_id":"","cve_id":"CVE-2024-1004","software_name":"Zoom","severity":"HIGH"}
                    ]}
                    """);
        });

        var found = src.findings(EnumSet.of(Severity.HIGH, Severity.CRITICAL));

        assertThat(found).singleElement().satisfies(f -> {
            assertThat(f.cveId()).isEqualTo("CVE-2024-1001");
            assertThat(f.softwareVersion()).isEqualTo("19.00");
            assertThat(f.cvssScore()).isEqualTo(7.8);
        });
        assertThat(seen.get().url().getPath()).isEqualTo("/api/findings");
        assertThat(seen.get().url().getQuery()).isEqualTo("severity=CRITICAL,HIGH");
        assertThat(seen.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer s3cret");
    }

    @Test
    void acceptsBareArray() {
        var src = source(req -> json(HttpStatus.OK, """
                [{"node_id":"ws-01","cve_id":"CVE-2024-2001","software_name":"Firefox","severity":"CRITICAL"}]
                """));

        assertThat(src.findings(Set.of())).hasSize(1);
    }

    @Test
    void serverErrorIsUpstreamUnavailable() {
        var src = source(req -> json(HttpStatus.BAD_GATEWAY, "{\"error\":\"scanner down\"}"));

        assertThatThrownBy(() -> src.findings(Set.of()))
                .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> {
                    assertThat(e.code()).isEqualTo(ErrorCode.UPSTREAM_UNAVAILABLE);
                    assertThat(e.getMessage()).contains("502").contains("scanner down");
                });
    }

    @Test
    void slowFeedTimesOut() {
        var src = source(req -> Mono.never());

        assertThatThrownBy(() -> src.findings(Set.of()))
                .isInstanceOfSatisfying(UpstreamUnavailableException.class,
                        e -> assertThat(e.code()).isEqualTo(ErrorCode.TIMEOUT));
    }
}
