package org.octofleet.orchestrator.service.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process topic pub/sub. Publishing from inside a transaction is deferred to
 * after commit, so listeners never observe a state that might still roll back.
 */
@Component
@Slf4j
public class EventBus {

    public static final String DEPLOYMENTS = "deployments";
    public static final String REMEDIATION = "remediation";
    public static final String NODES = "nodes";
    public static final String SESSIONS = "sessions";

    private static final String ALL = "*";

    private final Map<String, List<Consumer<FleetEvent>>> listeners = new ConcurrentHashMap<>();

    /** @return handle that removes the listener */
    public Runnable subscribe(String topic, Consumer<FleetEvent> listener) {
        var list = listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    public Runnable subscribeAll(Consumer<FleetEvent> listener) {
        return subscribe(ALL, listener);
    }

    public void publish(String topic, String type, String entityKey, Object payload) {
        var event = new FleetEvent(topic, type, entityKey, payload, Instant.now());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deliver(event);
                }
            });
        } else {
            deliver(event);
        }
    }

    private void deliver(FleetEvent event) {
        notify(listeners.get(event.topic()), event);
        notify(listeners.get(ALL), event);
    }

    private void notify(List<Consumer<FleetEvent>> list, FleetEvent event) {
        if (list == null) return;
        for (var l : list) {
            try {
                l.accept(event);
            } catch (RuntimeException e) {
                log.error("[EventBus] listener failed on {}/{}", event.topic(), event.type(), e);
            }
        }
    }
}
