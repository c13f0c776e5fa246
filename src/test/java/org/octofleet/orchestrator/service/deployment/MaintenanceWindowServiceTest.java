package org.octofleet.orchestrator.service.deployment;

import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.domain.MaintenanceWindow;
import org.octofleet.orchestrator.domain.TargetType;

import java.time.Instant;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceWindowServiceTest {

    private static MaintenanceWindow window(String days, String start, String end, String tz) {
        return MaintenanceWindow.builder().name("w").daysOfWeek(days)
                .startTime(LocalTime.parse(start)).endTime(LocalTime.parse(end))
                .timezone(tz).targetType(TargetType.ALL).enabled(true).build();
    }

    // 2024-06-02 is a Sunday
    @Test
    void sameDayWindowIsHalfOpen() {
        var w = window("0", "02:00", "04:00", "UTC");
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-02T02:00:00Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-02T03:59:59Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-02T04:00:00Z"))).isFalse();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-03T03:00:00Z"))).isFalse();
    }

    @Test
    void overnightWindowBelongsToItsStartDay() {
        // Saturday 22:00 -> Sunday 02:00
        var w = window("6", "22:00", "02:00", "UTC");
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-01T23:00:00Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-02T01:30:00Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-02T23:00:00Z"))).isFalse();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-01T01:30:00Z"))).isFalse();
    }

    @Test
    void evaluatesInTheWindowTimezone() {
        var w = window("", "02:00", "04:00", "Europe/Paris");
        // 01:30 UTC = 03:30 in Paris (CEST)
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-05T01:30:00Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-05T03:30:00Z"))).isFalse();
    }

    @Test
    void equalStartAndEndMeansWholeDay() {
        var w = window("1,2", "00:00", "00:00", "UTC");
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-03T13:00:00Z"))).isTrue();
        assertThat(MaintenanceWindowService.isOpen(w, Instant.parse("2024-06-05T13:00:00Z"))).isFalse();
    }
}
