package org.octofleet.orchestrator.domain;

public enum OverflowPolicy {
    /** evict that subscriber's oldest queued frame; upstream never waits */
    DROP_OLDEST,
    /** hold the agent ack until every subscriber has room */
    THROTTLE_UPSTREAM
}
