package org.octofleet.orchestrator.config;

import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient vulnerabilityWebClient(AppProps props) {
        var feed = props.vulnerability();
        HttpClient http = HttpClient.create();
        if (feed != null && feed.insecureTls()) {
            // LAB ONLY: self-signed scanner endpoints
            log.warn("[VulnFeed] TLS certificate verification disabled");
            http = http.secure(sslSpec -> {
                try {
                    sslSpec.sslContext(
                            SslContextBuilder.forClient()
                                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                                    .build()
                    );
                } catch (SSLException e) {
                    throw new IllegalStateException("Failed to build SSL context", e);
                }
            });
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(
                        ExchangeStrategies.builder()
                                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                                .build()
                )
                .build();
    }
}
