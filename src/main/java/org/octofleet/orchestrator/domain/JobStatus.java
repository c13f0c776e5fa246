package org.octofleet.orchestrator.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** pending -> approved -> running -> {success, failed, rolled_back, skipped} */
public enum JobStatus {
    PENDING, APPROVED, RUNNING, SUCCESS, FAILED, ROLLED_BACK, SKIPPED;

    /** States that block a second job for the same (node, CVE). */
    public static final Set<JobStatus> OPEN = EnumSet.of(PENDING, APPROVED, RUNNING);

    public boolean isTerminal() {
        return this == SUCCESS || this == ROLLED_BACK || this == SKIPPED;
    }

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static JobStatus fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("job status is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
