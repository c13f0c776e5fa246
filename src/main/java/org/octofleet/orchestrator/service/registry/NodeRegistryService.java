package org.octofleet.orchestrator.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.api.dto.EnrollRequest;
import org.octofleet.orchestrator.api.dto.NodeDTO;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.events.EventBus;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Fleet membership. Reads are unrestricted; every write (enrollment, heartbeat,
 * offline flip) locks exactly one node row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeRegistryService {

    private final NodeRepo repo;
    private final EventBus bus;
    private final AppProps props;
    private final Clock clock;
    private final TransactionTemplate tx;

    @Transactional
    public NodeDTO enroll(EnrollRequest r) {
        var nodeId = r.nodeId().trim();
        var now = clock.instant();
        var node = repo.findForUpdate(nodeId).orElseGet(() -> {
            var n = new Node();
            n.setNodeId(nodeId);
            n.setFirstSeen(now);
            return n;
        });
        boolean wasOnline = node.getId() != null && node.isOnline();

        node.setHostname(r.hostname().trim());
        node.setOsName(trimOrNull(r.osName()));
        node.setOsVersion(trimOrNull(r.osVersion()));
        node.setOsBuild(trimOrNull(r.osBuild()));
        node.setAgentVersion(trimOrNull(r.agentVersion()));
        node.setDomain(trimOrNull(r.domain()));
        if (r.tags() != null) node.setTags(Tags.toCsv(r.tags()));
        node.setOnline(true);
        node.setLastSeen(now);
        repo.save(node);

        var dto = toDto(node);
        if (!wasOnline) {
            log.info("[Registry] {} ({}) online", nodeId, node.getHostname());
            bus.publish(EventBus.NODES, "node_online", "node", dto);
        }
        return dto;
    }

    @Transactional
    public NodeDTO heartbeat(String nodeId, String agentVersion) {
        var node = repo.findForUpdate(nodeId).orElseThrow(() -> new NotFoundException("node", nodeId));
        node.setLastSeen(clock.instant());
        if (agentVersion != null && !agentVersion.isBlank()) node.setAgentVersion(agentVersion.trim());
        boolean flipped = !node.isOnline();
        node.setOnline(true);
        var dto = toDto(node);
        if (flipped) {
            log.info("[Registry] {} back online", nodeId);
            bus.publish(EventBus.NODES, "node_online", "node", dto);
        }
        return dto;
    }

    /** Heartbeat timeout monitor; returns how many nodes were flipped offline. */
    @Scheduled(fixedDelayString = "${app.registry.sweep-ms:15000}")
    public int sweepOffline() {
        var cutoff = clock.instant().minus(offlineAfter());
        int flipped = 0;
        for (var nodeId : repo.findStaleOnline(cutoff)) {
            Boolean done = tx.execute(s -> markOffline(nodeId, cutoff));
            if (Boolean.TRUE.equals(done)) flipped++;
        }
        if (flipped > 0) log.info("[Registry] {} node(s) flipped offline", flipped);
        return flipped;
    }

    private boolean markOffline(String nodeId, Instant cutoff) {
        var node = repo.findForUpdate(nodeId).orElse(null);
        // a heartbeat may have landed between the scan and the lock
        if (node == null || !node.isOnline()) return false;
        if (node.getLastSeen() != null && !node.getLastSeen().isBefore(cutoff)) return false;
        node.setOnline(false);
        log.warn("[Registry] {} offline, last seen {}", nodeId, node.getLastSeen());
        bus.publish(EventBus.NODES, "node_offline", "node", toDto(node));
        return true;
    }

    @Transactional
    public NodeDTO updateTags(String nodeId, List<String> tags) {
        var node = repo.findForUpdate(nodeId).orElseThrow(() -> new NotFoundException("node", nodeId));
        if (tags != null) node.setTags(Tags.toCsv(tags));
        return toDto(node);
    }

    @Transactional(readOnly = true)
    public List<NodeDTO> list(String q, Boolean online) {
        var needle = q == null ? "" : q.trim().toLowerCase(Locale.ROOT);
        return repo.findAllByOrderByHostnameAsc().stream()
                .filter(n -> online == null || n.isOnline() == online)
                .filter(n -> needle.isEmpty()
                        || n.getHostname().toLowerCase(Locale.ROOT).contains(needle)
                        || n.getNodeId().toLowerCase(Locale.ROOT).contains(needle))
                .map(this::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public NodeDTO get(String nodeId) {
        return repo.findByNodeId(nodeId).map(this::toDto)
                .orElseThrow(() -> new NotFoundException("node", nodeId));
    }

    @Transactional(readOnly = true)
    public List<Node> snapshot() {
        return repo.findAll();
    }

    public boolean exists(String nodeId) {
        return repo.existsByNodeId(nodeId);
    }

    public boolean isOnline(String nodeId) {
        return repo.findByNodeId(nodeId).map(Node::isOnline).orElse(false);
    }

    public NodeDTO toDto(Node n) {
        return new NodeDTO(n.getNodeId(), n.getHostname(),
                n.getOsName(), n.getOsVersion(), n.getOsBuild(),
                n.getAgentVersion(), n.getDomain(), Tags.fromCsv(n.getTags()),
                n.isOnline(), computeStatus(n.getLastSeen(), clock.instant()),
                n.getFirstSeen(), n.getLastSeen());
    }

    String computeStatus(Instant lastSeen, Instant now) {
        if (lastSeen == null) return "DOWN";
        var minutes = Duration.between(lastSeen, now).toMinutes();
        var s = props.status();
        if (minutes <= s.upMinutes())    return "UP";
        if (minutes <= s.staleMinutes()) return "STALE";
        return "DOWN";
    }

    private Duration offlineAfter() {
        var r = props.registry();
        return r == null || r.offlineAfter() == null ? Duration.ofSeconds(90) : r.offlineAfter();
    }

    private static String trimOrNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
