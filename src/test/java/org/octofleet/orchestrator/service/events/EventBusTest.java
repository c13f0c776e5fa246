package org.octofleet.orchestrator.service.events;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @AfterEach
    void clearSync() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void deliversToTopicAndWildcardListeners() {
        var jobs = new ArrayList<FleetEvent>();
        var all = new ArrayList<FleetEvent>();
        var nodes = new ArrayList<FleetEvent>();
        bus.subscribe(EventBus.REMEDIATION, jobs::add);
        bus.subscribe(EventBus.NODES, nodes::add);
        bus.subscribeAll(all::add);

        bus.publish(EventBus.REMEDIATION, "job_update", "job", Map.of("id", 7));

        assertThat(jobs).singleElement().satisfies(e -> {
            assertThat(e.topic()).isEqualTo(EventBus.REMEDIATION);
            assertThat(e.entityKey()).isEqualTo("job");
        });
        assertThat(all).hasSize(1);
        assertThat(nodes).isEmpty();
    }

    @Test
    void unsubscribeStopsDelivery() {
        var got = new ArrayList<FleetEvent>();
        var handle = bus.subscribe(EventBus.DEPLOYMENTS, got::add);

        handle.run();
        bus.publish(EventBus.DEPLOYMENTS, "deployment_update", "deployment", Map.of());

        assertThat(got).isEmpty();
    }

    @Test
    void failingListenerDoesNotStarveTheOthers() {
        var got = new ArrayList<FleetEvent>();
        bus.subscribe(EventBus.SESSIONS, e -> { throw new IllegalStateException("boom"); });
        bus.subscribe(EventBus.SESSIONS, got::add);

        bus.publish(EventBus.SESSIONS, "session_update", "session", Map.of());

        assertThat(got).hasSize(1);
    }

    @Test
    void publishInsideTransactionWaitsForCommit() {
        var got = new ArrayList<FleetEvent>();
        bus.subscribe(EventBus.DEPLOYMENTS, got::add);
        TransactionSynchronizationManager.initSynchronization();

        bus.publish(EventBus.DEPLOYMENTS, "deployment_update", "deployment", Map.of("id", "d1"));
        assertThat(got).isEmpty();

        List<TransactionSynchronization> syncs = TransactionSynchronizationManager.getSynchronizations();
        syncs.forEach(TransactionSynchronization::afterCommit);
        assertThat(got).hasSize(1);
    }

    @Test
    void rolledBackTransactionPublishesNothing() {
        var got = new ArrayList<FleetEvent>();
        bus.subscribe(EventBus.DEPLOYMENTS, got::add);
        TransactionSynchronizationManager.initSynchronization();

        bus.publish(EventBus.DEPLOYMENTS, "deployment_update", "deployment", Map.of("id", "d1"));
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        assertThat(got).isEmpty();
    }
}
