package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "remediation_packages")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class RemediationPackage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 512)
    private String description;

    @Column(nullable = false, length = 256)
    private String targetSoftware;

    @Column(length = 64)
    private String minFixedVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FixMethod fixMethod;

    @Column(length = 2000)
    private String fixCommand;

    @Column(length = 2000)
    private String rollbackCommand;

    private Long softwarePackageId; // fix_method = package

    @Column(nullable = false)
    private boolean enabled;

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
