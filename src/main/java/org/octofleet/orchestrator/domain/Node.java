package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "nodes", indexes = {
        @Index(name = "idx_node_last_seen", columnList = "last_seen")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Node {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "node_id", nullable = false, unique = true, length = 128)
    private String nodeId;

    @Column(nullable = false, length = 128)
    private String hostname;

    @Column(length = 128)
    private String osName;

    @Column(length = 64)
    private String osVersion;

    @Column(length = 64)
    private String osBuild;

    @Column(length = 64)
    private String agentVersion;

    @Column(length = 128)
    private String domain;

    @Column(length = 512)
    private String tags; // CSV, normalised lower-case

    @Column(nullable = false)
    private boolean online;

    private Instant firstSeen;

    @Column(name = "last_seen")
    private Instant lastSeen;
}
