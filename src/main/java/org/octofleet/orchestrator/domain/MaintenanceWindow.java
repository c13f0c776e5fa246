package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

@Entity
@Table(name = "maintenance_windows")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class MaintenanceWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 32)
    private String daysOfWeek; // CSV of 0..6, 0 = Sunday; blank = every day

    @Column(nullable = false)
    private LocalTime startTime;

    @Column(nullable = false)
    private LocalTime endTime;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TargetType targetType;

    @Column(length = 128)
    private String targetId; // group id or node id

    @Column(nullable = false)
    private boolean enabled;
}
