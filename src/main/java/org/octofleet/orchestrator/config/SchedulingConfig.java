package org.octofleet.orchestrator.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Turns on the background sweeps (heartbeat monitor, deployment reconciliation,
 * remediation auto-execution, live session idle timeouts, SSE heartbeats).
 * Tests switch it off with app.scheduling.enabled=false and call the sweeps directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    // named so @Scheduled picks it over the WebSocket support's own scheduler
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("sweep-");
        s.initialize();
        return s;
    }
}
