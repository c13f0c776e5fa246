package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "live_sessions", indexes = {
        @Index(name = "idx_live_session_node", columnList = "node_id")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class LiveSessionRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "node_id", nullable = false, length = 128)
    private String nodeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionState state;

    @Column(length = 512)
    private String reason;

    @Column(length = 128)
    private String requestedBy;

    @Column(length = 1000)
    private String options;

    private Instant createdAt;
    private Instant activatedAt;
    private Instant closedAt;
}
