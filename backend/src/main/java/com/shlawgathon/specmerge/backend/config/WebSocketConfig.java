package com.shlawgathon.specmerge.backend.config;

import com.shlawgathon.specmerge.backend.websocket.SpecEventWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SpecEventWebSocketHandler specEventWebSocketHandler;

    @Value("${frontend.url:http://localhost:3000}")
    private String frontendUrl;

    public WebSocketConfig(SpecEventWebSocketHandler specEventWebSocketHandler) {
        this.specEventWebSocketHandler = specEventWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Change notifications for the spec and defect views
        registry.addHandler(specEventWebSocketHandler, "/ws/specs")
                .setAllowedOrigins(frontendUrl);
    }
}
