package com.example.agentdeployer.monitoring;

import com.example.agentdeployer.n8n.InstanceHealth;
import com.example.agentdeployer.n8n.N8nClientFactory;
import com.example.agentdeployer.n8n.N8nExecution;
import com.example.agentdeployer.n8n.RemoteAutomationClient;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Health of a deployed workflow.
 *
 * {@link #checkHealth} takes a fresh snapshot on every call: liveness probe,
 * workflow active flag and the last {@value #EXECUTION_WINDOW} executions.
 * {@link #generateAlerts} turns one snapshot into alerts without touching anything remote.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthMonitor {

    public static final int EXECUTION_WINDOW = 20;
    public static final int HEALTHY_SUCCESS_RATE = 80;
    public static final int CRITICAL_SUCCESS_RATE = 50;
    public static final long SLOW_EXECUTION_MS = 30_000;

    static final String UNREACHABLE = "n8n instance is unreachable";

    private final N8nClientFactory clientFactory;
    private final MeterRegistry meterRegistry;

    public HealthCheckResult checkHealth(HealthMonitorConfig config) {
        Timer.Sample sample = Timer.start(meterRegistry);
        HealthCheckResult result = probe(config);
        sample.stop(Timer.builder("deployer.health_check.duration")
                .tag("healthy", String.valueOf(result.healthy()))
                .register(meterRegistry));
        return result;
    }

    private HealthCheckResult probe(HealthMonitorConfig config) {
        long start = System.currentTimeMillis();
        try {
            RemoteAutomationClient client = clientFactory.forInstance(config.n8nUrl(), config.n8nApiKey());

            InstanceHealth liveness = client.healthCheck();
            if (!liveness.healthy()) {
                String error = liveness.error() == null ? UNREACHABLE : UNREACHABLE + ": " + liveness.error();
                log.warn("Deployment {}: {}", config.deploymentId(), error);
                return HealthCheckResult.failure(config, Instant.now(), null, error);
            }

            JsonNode workflow = client.getWorkflow(config.workflowId());
            List<N8nExecution> executions = client.getExecutions(config.workflowId(), EXECUTION_WINDOW);

            HealthDetails details = computeDetails(workflow.path("active").asBoolean(false), executions);
            boolean healthy = details.workflowActive()
                    && details.successRate() >= HEALTHY_SUCCESS_RATE
                    && details.recentExecutions() > 0;
            LastExecution last = executions.isEmpty() ? null : LastExecution.from(executions.get(0));

            log.debug("Deployment {} healthy={} successRate={} executions={}",
                    config.deploymentId(), healthy, details.successRate(), details.recentExecutions());
            return new HealthCheckResult(config.deploymentId(), config.workflowId(), config.clientId(),
                    config.agentId(), healthy, Instant.now(), System.currentTimeMillis() - start,
                    last, null, details);
        } catch (RuntimeException e) {
            log.warn("Health check for deployment {} failed: {}", config.deploymentId(), e.getMessage());
            return HealthCheckResult.failure(config, Instant.now(), System.currentTimeMillis() - start,
                    e.getMessage());
        }
    }

    static HealthDetails computeDetails(boolean workflowActive, List<N8nExecution> executions) {
        if (executions.isEmpty()) {
            return new HealthDetails(workflowActive, 0, 100, 0);
        }
        long successful = executions.stream().filter(N8nExecution::isSuccess).count();
        int successRate = (int) Math.round(successful * 100.0 / executions.size());

        long totalMs = 0;
        int timed = 0;
        for (N8nExecution execution : executions) {
            if (execution.isTimed()) {
                totalMs += execution.durationMs();
                timed++;
            }
        }
        long avgMs = timed > 0 ? Math.round((double) totalMs / timed) : 0;
        return new HealthDetails(workflowActive, executions.size(), successRate, avgMs);
    }

    public List<HealthAlert> generateAlerts(HealthCheckResult result) {
        List<HealthAlert> alerts = new ArrayList<>();

        if (result.error() != null && result.error().contains("unreachable")) {
            alerts.add(alert(result, AlertType.CONNECTION_LOST, AlertSeverity.CRITICAL, "Cannot reach n8n instance"));
        }

        HealthDetails details = result.details();
        if (details != null) {
            if (!details.workflowActive()) {
                alerts.add(alert(result, AlertType.WORKFLOW_INACTIVE, AlertSeverity.WARNING, "Workflow is not active"));
            }
            if (details.successRate() < HEALTHY_SUCCESS_RATE) {
                AlertSeverity severity = details.successRate() < CRITICAL_SUCCESS_RATE
                        ? AlertSeverity.CRITICAL : AlertSeverity.ERROR;
                alerts.add(alert(result, AlertType.HIGH_FAILURE_RATE, severity,
                        "High failure rate: " + (100 - details.successRate()) + "% of recent executions failed"));
            }
            if (details.avgExecutionTimeMs() > SLOW_EXECUTION_MS) {
                alerts.add(alert(result, AlertType.SLOW_EXECUTION, AlertSeverity.WARNING,
                        "Slow execution time: " + Math.round(details.avgExecutionTimeMs() / 1000.0) + "s average"));
            }
        }

        if (result.lastExecution() != null && result.lastExecution().isError()) {
            alerts.add(alert(result, AlertType.EXECUTION_FAILED, AlertSeverity.ERROR, "Last workflow execution failed"));
        }
        return alerts;
    }

    private static HealthAlert alert(HealthCheckResult result, AlertType type, AlertSeverity severity, String message) {
        return new HealthAlert(alertId(result, type), result.deploymentId(), result.clientId(), result.agentId(),
                severity, type, message, result.timestamp(), false);
    }

    static String alertId(HealthCheckResult result, AlertType type) {
        String seed = result.deploymentId() + ":" + result.timestamp().toEpochMilli() + ":" + type.wireName();
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
