package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity @Table(name = "action_log", indexes = {
        @Index(name="idx_action_ts", columnList = "ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ActionLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(length = 64)
    private String userIp;
    @Column(length = 128)
    private String actor;       // token label or "api-key"
    @Column(length = 64)
    private String action;      // deployment.create, remediation.approve...
    @Column(length = 32)
    private String targetType;  // deployment, job, session, node
    @Column(length = 128)
    private String targetId;
    @Column(length=2000)
    private String details;
    private Instant ts;
}
