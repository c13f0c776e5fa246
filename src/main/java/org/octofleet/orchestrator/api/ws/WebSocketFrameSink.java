package org.octofleet.orchestrator.api.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.service.live.FrameSink;
import org.octofleet.orchestrator.service.live.LiveFrame;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** Viewer sink over a WebSocket; the session is expected to be a concurrent decorator. */
@Slf4j
class WebSocketFrameSink implements FrameSink {

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WebSocketFrameSink(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(LiveFrame frame) throws IOException {
        if (!session.isOpen()) throw new IOException("viewer socket closed");
        session.sendMessage(new TextMessage(mapper.writeValueAsString(frame.toMessage())));
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("[WS] close of viewer {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
