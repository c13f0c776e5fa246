package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "remediation_jobs", indexes = {
        @Index(name = "idx_job_node_cve", columnList = "node_id, cve_id"),
        @Index(name = "idx_job_status", columnList = "status")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class RemediationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "node_id", nullable = false, length = 128)
    private String nodeId;

    @Column(name = "cve_id", nullable = false, length = 64)
    private String cveId;

    @Column(nullable = false, length = 256)
    private String softwareName;

    @Column(length = 64)
    private String softwareVersion;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Severity severity;

    @ManyToOne(optional = false)
    @JoinColumn(name = "remediation_package_id", nullable = false)
    private RemediationPackage remediationPackage;

    @ManyToOne
    @JoinColumn(name = "rule_id")
    private RemediationRule rule;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(nullable = false)
    private boolean requiresApproval;

    @Column(length = 128)
    private String approvedBy;
    private Instant approvedAt;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 32)
    private String reasonCode; // NODE_OFFLINE, PACKAGE_UNAVAILABLE...

    private Integer exitCode;

    @Column(length = 4000)
    private String output;

    @Column(length = 2000)
    private String errorMessage;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
