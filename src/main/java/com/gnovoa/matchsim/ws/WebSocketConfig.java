package com.gnovoa.matchsim.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Live channels: one per match and one per round of parallel matches. Both are read-only for
 * clients; commands go through the REST API.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WsRouter router;
    private final String[] allowedOrigins;

    public WebSocketConfig(WsRouter router, @Value("${sim.ws.allowed-origins:*}") String[] allowedOrigins) {
        this.router = router;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(router, WsRouter.MATCH_PATH + "*", WsRouter.FIXTURE_PATH + "*")
                .setAllowedOrigins(allowedOrigins);
    }
}
