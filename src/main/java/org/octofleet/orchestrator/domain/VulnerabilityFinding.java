package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "vulnerability_findings",
        uniqueConstraints = @UniqueConstraint(name = "uq_finding",
                columnNames = {"node_id", "cve_id", "software_name"}))
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class VulnerabilityFinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "node_id", nullable = false, length = 128)
    private String nodeId;

    @Column(name = "cve_id", nullable = false, length = 64)
    private String cveId;

    @Column(name = "software_name", nullable = false, length = 256)
    private String softwareName;

    @Column(length = 64)
    private String softwareVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    private Double cvssScore;

    private Instant detectedAt;
}
