package com.example.agentdeployer.gateway;

import java.time.Instant;

/**
 * Envelope of every message pushed to WebSocket subscribers.
 *
 * @param event dotted event name, e.g. {@code deployment.progress}
 */
public record GatewayEvent(String event, Object data, Instant timestamp) {

    public static GatewayEvent of(String event, Object data) {
        return new GatewayEvent(event, data, Instant.now());
    }
}
