package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionState {
    PENDING, ACTIVE, CLOSED, ERROR;

    public boolean isTerminal() {
        return this == CLOSED || this == ERROR;
    }

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }
}
