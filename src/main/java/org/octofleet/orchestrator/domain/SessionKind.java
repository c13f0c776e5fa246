package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionKind {
    METRICS(false, OverflowPolicy.DROP_OLDEST),
    LOGS(false, OverflowPolicy.DROP_OLDEST),
    SHELL(true, OverflowPolicy.THROTTLE_UPSTREAM),
    SCREEN(true, OverflowPolicy.THROTTLE_UPSTREAM);

    private final boolean exclusive;
    private final OverflowPolicy overflow;

    SessionKind(boolean exclusive, OverflowPolicy overflow) {
        this.exclusive = exclusive;
        this.overflow = overflow;
    }

    /** one pending/active session of this kind per node */
    public boolean exclusive() { return exclusive; }

    public OverflowPolicy overflow() { return overflow; }

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static SessionKind fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("session kind is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
