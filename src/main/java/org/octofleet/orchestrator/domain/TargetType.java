package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetType {
    NODE, GROUP, ALL;

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static TargetType fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("target type is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
