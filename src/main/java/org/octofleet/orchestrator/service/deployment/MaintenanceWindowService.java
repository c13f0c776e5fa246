package org.octofleet.orchestrator.service.deployment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.ActiveWindowsDTO;
import org.octofleet.orchestrator.api.dto.MaintenanceWindowDTO;
import org.octofleet.orchestrator.api.dto.MaintenanceWindowRequest;
import org.octofleet.orchestrator.api.error.ErrorCode;
import org.octofleet.orchestrator.domain.MaintenanceWindow;
import org.octofleet.orchestrator.domain.TargetType;
import org.octofleet.orchestrator.repo.MaintenanceWindowRepo;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.ValidationException;
import org.octofleet.orchestrator.service.group.TargetResolver;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Recurring local-time windows in which maintenance-only work may run.
 * Days are 0 = Sunday .. 6 = Saturday; a window whose end is before its start
 * runs past midnight into the next day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceWindowService {

    private final MaintenanceWindowRepo repo;
    private final TargetResolver targets;
    private final Clock clock;

    @Transactional
    public MaintenanceWindowDTO create(MaintenanceWindowRequest r) {
        var zone = r.timezone() == null || r.timezone().isBlank() ? "UTC" : r.timezone().trim();
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ValidationException(ErrorCode.BAD_REQUEST, "unknown timezone: " + zone);
        }
        var type = r.targetType() == null ? TargetType.ALL : r.targetType();
        if (type != TargetType.ALL && (r.targetId() == null || r.targetId().isBlank())) {
            throw ValidationException.invalidTarget("target_id is required for a " + type.wire() + " window");
        }
        var days = r.daysOfWeek() == null ? "" : new TreeSet<>(r.daysOfWeek()).stream()
                .map(String::valueOf).collect(Collectors.joining(","));
        var w = MaintenanceWindow.builder()
                .name(r.name().trim())
                .daysOfWeek(days)
                .startTime(r.startTime())
                .endTime(r.endTime())
                .timezone(zone)
                .targetType(type)
                .targetId(type == TargetType.ALL ? null : r.targetId().trim())
                .enabled(r.enabled() == null || r.enabled())
                .build();
        repo.save(w);
        return toDto(w);
    }

    @Transactional
    public void delete(Long id) {
        repo.delete(repo.findById(id).orElseThrow(() -> new NotFoundException("maintenance window", id)));
    }

    @Transactional(readOnly = true)
    public List<MaintenanceWindowDTO> list() {
        return repo.findAllByOrderByNameAsc().stream().map(this::toDto).toList();
    }

    @Transactional(readOnly = true)
    public ActiveWindowsDTO active(String nodeId) {
        var now = clock.instant();
        var open = repo.findByEnabledTrue().stream()
                .filter(w -> isOpen(w, now))
                .filter(w -> nodeId == null || targets.covers(w.getTargetType(), w.getTargetId(), nodeId))
                .map(this::toDto)
                .toList();
        return new ActiveWindowsDTO(nodeId, !open.isEmpty(), open);
    }

    /** True when an enabled window that applies to the node is open right now. */
    @Transactional(readOnly = true)
    public boolean inWindow(String nodeId, Instant now) {
        return repo.findByEnabledTrue().stream()
                .anyMatch(w -> isOpen(w, now) && targets.covers(w.getTargetType(), w.getTargetId(), nodeId));
    }

    @Transactional(readOnly = true)
    public boolean anyOpen(Instant now) {
        return repo.findByEnabledTrue().stream().anyMatch(w -> isOpen(w, now));
    }

    static boolean isOpen(MaintenanceWindow w, Instant now) {
        var local = now.atZone(ZoneId.of(w.getTimezone()));
        int today = local.getDayOfWeek().getValue() % 7;
        int yesterday = (today + 6) % 7;
        var t = local.toLocalTime();
        LocalTime start = w.getStartTime(), end = w.getEndTime();
        var days = days(w.getDaysOfWeek());

        if (start.equals(end)) return days.isEmpty() || days.contains(today);
        if (start.isBefore(end)) {
            return (days.isEmpty() || days.contains(today)) && !t.isBefore(start) && t.isBefore(end);
        }
        // crosses midnight: the evening part belongs to today, the morning part to yesterday's window
        if (!t.isBefore(start)) return days.isEmpty() || days.contains(today);
        return t.isBefore(end) && (days.isEmpty() || days.contains(yesterday));
    }

    private static Set<Integer> days(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .map(Integer::valueOf).collect(Collectors.toSet());
    }

    private MaintenanceWindowDTO toDto(MaintenanceWindow w) {
        return new MaintenanceWindowDTO(w.getId(), w.getName(), days(w.getDaysOfWeek()).stream().sorted().toList(),
                w.getStartTime(), w.getEndTime(), w.getTimezone(), w.getTargetType(), w.getTargetId(), w.isEnabled());
    }
}
