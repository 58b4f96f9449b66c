package com.example.agentdeployer.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Push-only WebSocket endpoint for deployment progress and health events.
 * Inbound messages are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventGatewayHandler extends TextWebSocketHandler {

    public static final String DEPLOYMENT_PROGRESS = "deployment.progress";
    public static final String DEPLOYMENT_COMPLETED = "deployment.completed";
    public static final String DEPLOYMENT_FAILED = "deployment.failed";
    public static final String HEALTH_CHECKED = "health.checked";
    public static final String HEALTH_ALERT = "health.alert";

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.info("Event subscriber connected: {} (total: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring inbound message from {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Event subscriber disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    public void broadcast(String event, Object data) {
        if (sessions.isEmpty()) {
            return;
        }
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(GatewayEvent.of(event, data)));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} event: {}", event, e.getMessage());
            return;
        }
        sessions.values().forEach(session -> {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to send {} to session {}: {}", event, session.getId(), e.getMessage());
            }
        });
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }
}
