package com.example.agentdeployer.monitoring;

import java.time.Instant;

public record HealthAlert(
        String id,
        String deploymentId,
        String clientId,
        String agentId,
        AlertSeverity severity,
        AlertType type,
        String message,
        Instant timestamp,
        boolean acknowledged
) {
}
