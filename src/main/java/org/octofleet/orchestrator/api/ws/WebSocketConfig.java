package org.octofleet.orchestrator.api.ws;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ViewerWebSocketHandler viewers;
    private final AgentSessionWebSocketHandler agents;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var interceptor = new SessionPathInterceptor();
        registry.addHandler(viewers, "/api/v1/screen/ws/*", "/api/v1/shell/ws/*")
                .addInterceptors(interceptor)
                .setAllowedOriginPatterns("*");
        registry.addHandler(agents, "/api/v1/agent/sessions/*/ws")
                .addInterceptors(interceptor)
                .setAllowedOriginPatterns("*");
    }
}
