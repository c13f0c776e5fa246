package org.octofleet.orchestrator.api.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.octofleet.orchestrator.domain.SessionKind;
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

/**
 * Screen and shell viewers. The socket is bound to the session named in the path; the
 * path kind has to match the session kind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ViewerWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 4 * 1024 * 1024;
    private static final TypeReference<Map<String, Object>> MESSAGE = new TypeReference<>() { };

    private final LiveSessionBroker broker;
    private final ObjectMapper mapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        var pathKind = (String) session.getAttributes().get(SessionPathInterceptor.VIEWER_KIND);
        var kind = broker.kindOf(sessionId).orElse(null);
        if (kind == null || pathKind == null || kind != SessionKind.fromWire(pathKind)) {
            reject(session, "unknown " + pathKind + " session: " + sessionId);
            return;
        }
        var safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        try {
            broker.subscribe(sessionId, new WebSocketFrameSink(safe, mapper));
        } catch (FleetException e) {
            reject(session, e.getMessage());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        try {
            broker.onClientMessage(sessionId, session.getId(), mapper.readValue(message.getPayload(), MESSAGE));
        } catch (JsonProcessingException e) {
            log.debug("[WS] malformed viewer message on {}: {}", sessionId, e.getOriginalMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        var sessionId = (String) session.getAttributes().get(SessionPathInterceptor.SESSION_ID);
        broker.unsubscribe(sessionId, session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("[WS] viewer transport error on {}: {}", session.getId(), exception.getMessage());
    }

    private void reject(WebSocketSession session, String why) throws IOException {
        session.sendMessage(new TextMessage(mapper.writeValueAsString(Map.of("type", "error", "message", why))));
        session.close(CloseStatus.POLICY_VIOLATION.withReason(why.length() > 120 ? why.substring(0, 120) : why));
    }
}
