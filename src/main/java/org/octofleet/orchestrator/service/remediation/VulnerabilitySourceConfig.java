package org.octofleet.orchestrator.service.remediation;

import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.repo.VulnerabilityFindingRepo;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class VulnerabilitySourceConfig {

    /** Remote feed when app.vulnerability.base-url is set, otherwise the findings table. */
    @Bean
    public VulnerabilitySource vulnerabilitySource(AppProps props, WebClient vulnerabilityWebClient,
                                                   VulnerabilityFindingRepo findings) {
        var feed = props.vulnerability();
        if (feed != null && feed.baseUrl() != null && !feed.baseUrl().isBlank()) {
            return new RemoteVulnerabilitySource(vulnerabilityWebClient, feed);
        }
        return new JpaVulnerabilitySource(findings);
    }
}
