package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-node rollout state. Declaration order is the forward order;
 * the only backward move is failed -> pending on retry.
 */
public enum NodeRolloutStatus {
    PENDING, DOWNLOADING, INSTALLING, SUCCESS, FAILED, SKIPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }

    /** An install command has been handed to the agent and no outcome is known yet. */
    public boolean isInFlight() {
        return this == DOWNLOADING || this == INSTALLING;
    }

    public boolean isAfter(NodeRolloutStatus other) {
        return ordinal() > other.ordinal();
    }

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static NodeRolloutStatus fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("node status is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
