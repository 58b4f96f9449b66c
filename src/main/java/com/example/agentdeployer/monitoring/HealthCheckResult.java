package com.example.agentdeployer.monitoring;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Snapshot of one deployment's health. {@code details} is absent when the check
 * could not get past the liveness probe or a remote call failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthCheckResult(
        String deploymentId,
        String workflowId,
        String clientId,
        String agentId,
        boolean healthy,
        Instant timestamp,
        Long latencyMs,
        LastExecution lastExecution,
        String error,
        HealthDetails details
) {

    static HealthCheckResult failure(HealthMonitorConfig config, Instant timestamp, Long latencyMs, String error) {
        return new HealthCheckResult(config.deploymentId(), config.workflowId(), config.clientId(), config.agentId(),
                false, timestamp, latencyMs, null, error, null);
    }
}
