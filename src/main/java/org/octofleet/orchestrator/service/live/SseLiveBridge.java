package org.octofleet.orchestrator.service.live;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.domain.SessionKind;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves a node's metrics stream as Server-Sent Events. Event names follow the frame type
 * ({@code metrics}, {@code processes}, {@code logs}); the stream opens with {@code connected}
 * and ends with {@code disconnected}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SseLiveBridge {

    private final LiveSessionBroker broker;

    private final Map<String, SseSink> open = new ConcurrentHashMap<>();

    public SseEmitter open(String nodeId, SessionKind kind, String requestedBy) {
        var started = broker.start(nodeId, kind, Map.of(), requestedBy);
        var emitter = new SseEmitter(0L);
        var sink = new SseSink(UUID.randomUUID().toString(), started.sessionId(), emitter);

        emitter.onCompletion(() -> detach(sink));
        emitter.onTimeout(() -> detach(sink));
        emitter.onError(t -> detach(sink));

        try {
            emitter.send(SseEmitter.event().name("connected")
                    .data(Map.of("session_id", started.sessionId(), "node_id", nodeId, "kind", kind.wire())));
        } catch (IOException e) {
            emitter.completeWithError(e);
            return emitter;
        }
        open.put(sink.id(), sink);
        broker.subscribe(started.sessionId(), sink);
        return emitter;
    }

    /** Keep-alive event; a successful write counts as viewer traffic for the idle timeout. */
    @Scheduled(fixedDelayString = "${app.sessions.sse-heartbeat-ms:15000}")
    public void heartbeat() {
        for (var sink : open.values()) {
            try {
                sink.emitter.send(SseEmitter.event().name("heartbeat").data(Map.of("ts", Instant.now().toString())));
                broker.touchClient(sink.sessionId);
            } catch (IOException | IllegalStateException e) {
                log.debug("[SSE] heartbeat failed for {}: {}", sink.id(), e.getMessage());
                detach(sink);
            }
        }
    }

    int openStreams() {
        return open.size();
    }

    private void detach(SseSink sink) {
        if (open.remove(sink.id()) != null) {
            broker.unsubscribe(sink.sessionId, sink.id());
        }
    }

    private final class SseSink implements FrameSink {
        private final String id;
        private final String sessionId;
        private final SseEmitter emitter;

        SseSink(String id, String sessionId, SseEmitter emitter) {
            this.id = id;
            this.sessionId = sessionId;
            this.emitter = emitter;
        }

        @Override
        public String id() { return id; }

        @Override
        public void send(LiveFrame frame) throws IOException {
            var name = switch (frame.type()) {
                case "closed", "error" -> "disconnected";
                default -> frame.type();
            };
            var data = frame.fields().containsKey("data") && frame.fields().size() == 1
                    ? frame.fields().get("data")
                    : frame.toMessage();
            emitter.send(SseEmitter.event().name(name).data(data));
        }

        @Override
        public void close() {
            open.remove(id);
            emitter.complete();
        }
    }
}
