package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FixMethod {
    WINGET, CHOCO, PACKAGE, SCRIPT;

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static FixMethod fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("fix method is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
