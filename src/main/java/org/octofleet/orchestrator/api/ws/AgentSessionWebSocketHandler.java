package org.octofleet.orchestrator.api.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.service.FleetException;
import org.octofleet.orchestrator.service.live.LiveSessionBroker;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;

/** Agent end of a live session: info, data frames with seq, error, closed/exit. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentSessionWebSocketHandler extends TextWebSocketHandler {

    private static final TypeReference<Map<String, Object>> MESSAGE = new TypeReference<>() { };

    private final LiveSessionBroker broker;
    private final ObjectMapper mapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        var safe = new ConcurrentWebSocketSessionDecorator(session, 10_000, 512 * 1024);
        try {
            broker.attachUpstream(sessionId, new WebSocketUpstream(safe, mapper));
            log.info("[WS] agent channel open for session {}", sessionId);
        } catch (FleetException e) {
            session.getAttributes().put("rejected", Boolean.TRUE);
            session.close(CloseStatus.POLICY_VIOLATION.withReason(e.code().name()));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        try {
            broker.onUpstreamMessage(sessionId, mapper.readValue(message.getPayload(), MESSAGE));
        } catch (JsonProcessingException e) {
            log.warn("[WS] malformed agent message on {}: {}", sessionId, e.getOriginalMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        if (Boolean.TRUE.equals(session.getAttributes().get("rejected"))) return;
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        broker.onUpstreamClosed(sessionId);
    }
}
