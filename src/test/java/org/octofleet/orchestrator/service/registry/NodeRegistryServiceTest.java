package org.octofleet.orchestrator.service.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.octofleet.orchestrator.MutableClock;
import org.octofleet.orchestrator.api.dto.EnrollRequest;
import org.octofleet.orchestrator.config.AppProps;
import org.octofleet.orchestrator.domain.Node;
import org.octofleet.orchestrator.repo.NodeRepo;
import org.octofleet.orchestrator.service.NotFoundException;
import org.octofleet.orchestrator.service.events.EventBus;
import org.octofleet.orchestrator.service.events.FleetEvent;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NodeRegistryServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-03T10:00:00Z");

    private final NodeRepo repo = mock(NodeRepo.class);
    private final TransactionTemplate tx = mock(TransactionTemplate.class);
    private final EventBus bus = new EventBus();
    private final MutableClock clock = new MutableClock(NOW);
    private final List<FleetEvent> events = new ArrayList<>();
    private NodeRegistryService registry;

    @BeforeEach
    void setUp() {
        var props = new AppProps(null, new AppProps.StatusProps(2, 10),
                new AppProps.RegistryProps(Duration.ofSeconds(90)), null, null, null, null);
        when(tx.execute(any())).thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
        bus.subscribe(EventBus.NODES, events::add);
        registry = new NodeRegistryService(repo, bus, props, clock, tx);
    }

    private static Node node(String id, boolean online, Instant lastSeen) {
        return Node.builder().id(1L).nodeId(id).hostname(id.toUpperCase()).tags("").online(online).lastSeen(lastSeen).build();
    }

    @Test
    void statusBucketsFollowLastSeen() {
        assertThat(registry.computeStatus(NOW.minusSeconds(60), NOW)).isEqualTo("UP");
        assertThat(registry.computeStatus(NOW.minusSeconds(5 * 60), NOW)).isEqualTo("STALE");
        assertThat(registry.computeStatus(NOW.minusSeconds(11 * 60), NOW)).isEqualTo("DOWN");
        assertThat(registry.computeStatus(null, NOW)).isEqualTo("DOWN");
    }

    @Test
    void firstEnrollmentAnnouncesTheNode() {
        when(repo.findForUpdate("ws-01")).thenReturn(Optional.empty());

        var dto = registry.enroll(new EnrollRequest(" ws-01 ", "WS-01", "Windows 11 Pro", "23H2", "22631",
                "0.4.2", null, List.of("Finance", "finance", " DMZ ")));

        assertThat(dto.nodeId()).isEqualTo("ws-01");
        assertThat(dto.online()).isTrue();
        assertThat(dto.tags()).containsExactly("finance", "dmz");
        assertThat(dto.firstSeen()).isEqualTo(NOW);
        assertThat(events).extracting(FleetEvent::type).containsExactly("node_online");
    }

    @Test
    void reEnrollmentOfAnOnlineNodeIsQuiet() {
        when(repo.findForUpdate("ws-01")).thenReturn(Optional.of(node("ws-01", true, NOW.minusSeconds(30))));

        registry.enroll(new EnrollRequest("ws-01", "WS-01", null, null, null, "0.4.3", null, null));

        assertThat(events).isEmpty();
    }

    @Test
    void heartbeatBringsAnOfflineNodeBack() {
        var n = node("ws-02", false, NOW.minusSeconds(600));
        when(repo.findForUpdate("ws-02")).thenReturn(Optional.of(n));

        var dto = registry.heartbeat("ws-02", "0.5.0");

        assertThat(dto.online()).isTrue();
        assertThat(dto.status()).isEqualTo("UP");
        assertThat(n.getAgentVersion()).isEqualTo("0.5.0");
        assertThat(events).extracting(FleetEvent::type).containsExactly("node_online");
    }

    @Test
    void heartbeatFromUnknownNodeIsNotFound() {
        when(repo.findForUpdate("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> registry.heartbeat("ghost", null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void sweepFlipsOnlyNodesStillSilentUnderTheLock() {
        var silent = node("ws-03", true, NOW.minusSeconds(120));
        var raced = node("ws-04", true, NOW.minusSeconds(5));
        when(repo.findStaleOnline(NOW.minusSeconds(90))).thenReturn(List.of("ws-03", "ws-04"));
        when(repo.findForUpdate("ws-03")).thenReturn(Optional.of(silent));
        when(repo.findForUpdate("ws-04")).thenReturn(Optional.of(raced));

        assertThat(registry.sweepOffline()).isEqualTo(1);
        assertThat(silent.isOnline()).isFalse();
        assertThat(raced.isOnline()).isTrue();
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.type()).isEqualTo("node_offline");
            assertThat(e.entityKey()).isEqualTo("node");
        });
    }
}
