package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "deployment_node_status",
        uniqueConstraints = @UniqueConstraint(name = "uq_deployment_node", columnNames = {"deployment_id", "node_id"}),
        indexes = @Index(name = "idx_dns_node", columnList = "node_id"))
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class NodeDeploymentStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "deployment_id", nullable = false)
    private Deployment deployment;

    @Column(name = "node_id", nullable = false, length = 128)
    private String nodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private NodeRolloutStatus status;

    @Column(nullable = false)
    private int attempts;

    private Instant startedAt;
    private Instant completedAt;
    private Instant lastAttemptAt;

    private Integer exitCode;

    @Column(length = 4000)
    private String output;

    @Column(length = 2000)
    private String errorMessage;
}
