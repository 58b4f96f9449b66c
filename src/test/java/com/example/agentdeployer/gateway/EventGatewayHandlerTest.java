package com.example.agentdeployer.gateway;

import com.example.agentdeployer.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventGatewayHandlerTest {

    private final EventGatewayHandler handler = new EventGatewayHandler(new AppConfig().objectMapper());

    private static WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void failingSubscriberDoesNotStopBroadcast() throws Exception {
        WebSocketSession broken = session("broken");
        WebSocketSession healthy = session("healthy");
        doThrow(new IllegalStateException("send buffer full")).when(broken).sendMessage(any());
        handler.afterConnectionEstablished(broken);
        handler.afterConnectionEstablished(healthy);

        assertDoesNotThrow(() -> handler.broadcast(EventGatewayHandler.DEPLOYMENT_PROGRESS,
                Map.of("deploymentId", "dep-1")));

        verify(healthy).sendMessage(any(TextMessage.class));
        assertEquals(2, handler.getActiveSessionCount());
    }
}
