package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeploymentStatus {
    PENDING, ACTIVE, PAUSED, COMPLETED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(DeploymentStatus next) {
        return switch (this) {
            case PENDING -> next == ACTIVE || next == CANCELLED;
            case ACTIVE -> next == PAUSED || next == CANCELLED || next == COMPLETED;
            case PAUSED -> next == ACTIVE || next == CANCELLED || next == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static DeploymentStatus fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("deployment status is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
