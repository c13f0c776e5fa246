package org.octofleet.orchestrator.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static groups carry their members; dynamic groups carry only the rule JSON and
 * are evaluated against the registry on every read.
 */
@Entity
@Table(name = "node_groups")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class NodeGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String name;

    @Column(length = 512)
    private String description;

    @Column(nullable = false)
    private boolean dynamic;

    @Column(name = "rule_json", length = 4000)
    private String ruleJson;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "node_group_members", joinColumns = @JoinColumn(name = "group_id"))
    @Column(name = "node_id", length = 128)
    @Builder.Default
    private Set<String> members = new LinkedHashSet<>();

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
