package org.octofleet.orchestrator;

import org.octofleet.orchestrator.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProps.class)
public class OctofleetOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OctofleetOrchestratorApplication.class, args);
    }

}
