package org.octofleet.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app")
public record AppProps(AuthProps auth, StatusProps status, RegistryProps registry,
                       DeploymentProps deployments, RemediationProps remediation,
                       SessionProps sessions, VulnerabilityProps vulnerability) {
    /** Static API key (legacy agents/scripts) and accepted bearer tokens */
    public record AuthProps(String apiKey, List<String> tokens) {}
    /** Coarse UP/STALE/DOWN windows shown next to a node */
    public record StatusProps(int upMinutes, int staleMinutes) {}
    /** Heartbeat timeout after which a node is flipped offline */
    public record RegistryProps(Duration offlineAfter) {}
    /** An in-flight row with no report for {@code inFlightTimeout} counts as a failed attempt */
    public record DeploymentProps(int retryCeiling, Duration sweepWarnAfter, Duration inFlightTimeout) {}
    public record RemediationProps(int recentJobs) {}
    public record SessionProps(Duration idleTimeout, Duration pendingTimeout, Duration retainClosed,
                               int queueCapacity, int upstreamWindow) {}
    /** Optional remote vulnerability feed; blank baseUrl = findings table */
    public record VulnerabilityProps(String baseUrl, String token, boolean insecureTls, Duration timeout) {}
}
