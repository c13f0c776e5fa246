package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW;

    /** true when this severity is at least as severe as the threshold */
    public boolean meets(Severity threshold) {
        return ordinal() <= threshold.ordinal();
    }

    @JsonCreator
    public static Severity parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("severity is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
