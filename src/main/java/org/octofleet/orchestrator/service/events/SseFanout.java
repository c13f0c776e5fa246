package org.octofleet.orchestrator.service.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/** Bridges event bus topics to dashboard SSE streams. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SseFanout {

    private final EventBus bus;

    /** @param topic one of the {@link EventBus} topics, or null for every topic */
    public SseEmitter subscribe(String topic) {
        var emitter = new SseEmitter(0L);
        var unsubscribe = new AtomicReference<Runnable>(() -> { });

        Runnable handle = topic == null
                ? bus.subscribeAll(e -> send(emitter, e, unsubscribe))
                : bus.subscribe(topic, e -> send(emitter, e, unsubscribe));
        unsubscribe.set(handle);

        emitter.onCompletion(handle);
        emitter.onTimeout(handle);
        emitter.onError(t -> handle.run());

        try {
            emitter.send(SseEmitter.event().name("connected").data(Map.of("topic", topic == null ? "all" : topic)));
        } catch (IOException e) {
            handle.run();
            emitter.completeWithError(e);
        }
        return emitter;
    }

    static Map<String, Object> body(FleetEvent e) {
        var body = new LinkedHashMap<String, Object>();
        body.put("type", e.type());
        body.put(e.entityKey(), e.payload());
        return body;
    }

    private void send(SseEmitter emitter, FleetEvent e, AtomicReference<Runnable> unsubscribe) {
        try {
            emitter.send(SseEmitter.event().name(e.type()).data(body(e)));
        } catch (IOException | IllegalStateException ex) {
            log.debug("[SSE] dropping subscriber on {}: {}", e.topic(), ex.getMessage());
            unsubscribe.get().run();
        }
    }
}
