package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "remediation_rules")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class RemediationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity minSeverity;

    @Column(length = 256)
    private String softwarePattern; // regex, case-insensitive

    @Column(nullable = false)
    private boolean autoRemediate;

    @Column(nullable = false)
    private boolean requireApproval;

    @Column(nullable = false)
    private boolean maintenanceWindowOnly;

    @Column(nullable = false)
    private boolean enabled;

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
