package org.octofleet.orchestrator.api.ws;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pulls the live session id (and, for viewers, the stream kind) out of the handshake path.
 * Handshakes whose path carries no session id are refused.
 */
public class SessionPathInterceptor implements HandshakeInterceptor {

    public static final String SESSION_ID = "liveSessionId";
    public static final String VIEWER_KIND = "viewerKind";

    private static final Pattern VIEWER = Pattern.compile("/api/v1/(screen|shell)/ws/([^/]+)$");
    private static final Pattern AGENT = Pattern.compile("/api/v1/agent/sessions/([^/]+)/ws$");

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        var path = request.getURI().getPath();
        var viewer = VIEWER.matcher(path);
        if (viewer.find()) {
            attributes.put(VIEWER_KIND, viewer.group(1));
            attributes.put(SESSION_ID, viewer.group(2));
            return true;
        }
        var agent = AGENT.matcher(path);
        if (agent.find()) {
            attributes.put(SESSION_ID, agent.group(1));
            return true;
        }
        return false;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to clean up
    }
}
