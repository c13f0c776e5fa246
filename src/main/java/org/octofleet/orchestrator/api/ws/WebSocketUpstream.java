package org.octofleet.orchestrator.api.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.service.live.UpstreamChannel;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

@Slf4j
class WebSocketUpstream implements UpstreamChannel {

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    WebSocketUpstream(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public void send(Map<String, Object> message) throws IOException {
        if (!session.isOpen()) throw new IOException("agent socket closed");
        session.sendMessage(new TextMessage(mapper.writeValueAsString(message)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("[WS] close of agent socket {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
