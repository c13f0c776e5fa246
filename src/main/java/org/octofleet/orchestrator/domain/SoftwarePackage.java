package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "software_packages", uniqueConstraints = {
        @UniqueConstraint(name = "uq_package_name_version", columnNames = {"name", "version"})
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class SoftwarePackage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 64)
    private String version;

    @Column(length = 256)
    private String displayName;

    @Column(length = 1024)
    private String installerUrl;

    @Column(length = 128)
    private String sha256;

    @Column(length = 2000)
    private String installCommand;

    @Column(length = 2000)
    private String uninstallCommand;

    @Column(nullable = false)
    private boolean active;

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
