package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RolloutMode {
    REQUIRED, AVAILABLE, UNINSTALL;

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static RolloutMode fromWire(String s) {
        if (s == null || s.isBlank()) return REQUIRED;
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
