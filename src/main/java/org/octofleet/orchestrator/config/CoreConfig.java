package org.octofleet.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Drains per-subscriber live frame queues; one task per subscriber at a time. */
    @Bean(name = "liveRelayExecutor")
    public ThreadPoolTaskExecutor liveRelayExecutor() {
        var ex = new ThreadPoolTaskExecutor();
        ex.setThreadNamePrefix("live-relay-");
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(10_000);
        ex.initialize();
        return ex;
    }
}
