package com.shlawgathon.specmerge.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tells connected views that the stores changed so they re-read the projection.
 * Messages carry what changed, never projected values.
 */
@Component
public class SpecEventWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SpecEventWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    // sessionId -> session
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public SpecEventWebSocketHandler(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("[WS] Connected session: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("[WS] Disconnected session: {} ({})", session.getId(), status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("[WS] Ignoring client message: {}", message.getPayload());
    }

    /**
     * Send a change notification to every open session.
     */
    public void broadcast(String type, Map<String, Object> data) {
        if (sessions.isEmpty()) {
            return;
        }

        WebSocketMessage message = WebSocketMessage.builder()
                .type(type)
                .data(data)
                .sentAt(clock.instant())
                .build();

        TextMessage textMessage;
        try {
            textMessage = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (IOException e) {
            log.error("[WS] Failed to serialize {} event", type, e);
            return;
        }

        sessions.values().forEach(session -> {
            try {
                if (session.isOpen()) {
                    // sessions are not thread-safe for concurrent sends
                    synchronized (session) {
                        session.sendMessage(textMessage);
                    }
                }
            } catch (IOException e) {
                log.error("[WS] Failed to send {} to session: {}", type, session.getId(), e);
            }
        });
    }

    public int sessionCount() {
        return sessions.size();
    }
}
