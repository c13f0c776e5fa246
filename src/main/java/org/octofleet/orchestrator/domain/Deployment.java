package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "deployments", indexes = {
        @Index(name = "idx_deployment_status", columnList = "status")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Deployment {

    @Id
    @Column(length = 36)
    private String id; // UUID string

    @Column(nullable = false, length = 256)
    private String name;

    @Column(nullable = false)
    private Long packageId;

    @Column(nullable = false, length = 128)
    private String packageName;

    @Column(nullable = false, length = 64)
    private String packageVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TargetType targetType;

    @Column(length = 128)
    private String targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rollout_mode", nullable = false, length = 16)
    private RolloutMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeploymentStatus status;

    private Instant scheduledStart;
    private Instant scheduledEnd;

    @Column(nullable = false)
    private boolean maintenanceWindowOnly;

    @Column(length = 128)
    private String createdBy;

    private Instant createdAt;
    private Instant activatedAt;
    private Instant completedAt;

    // resolved once at creation; never re-resolved
    @OneToMany(mappedBy = "deployment", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<NodeDeploymentStatus> nodes = new ArrayList<>();

    public void addNode(NodeDeploymentStatus row) {
        row.setDeployment(this);
        nodes.add(row);
    }

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }
}
