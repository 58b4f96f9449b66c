package com.example.agentdeployer.service;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.domain.Client;
import com.example.agentdeployer.domain.Deployment;
import com.example.agentdeployer.domain.DeploymentAlert;
import com.example.agentdeployer.domain.HealthCheckRecord;
import com.example.agentdeployer.domain.HealthError;
import com.example.agentdeployer.domain.Notification;
import com.example.agentdeployer.gateway.EventGatewayHandler;
import com.example.agentdeployer.monitoring.HealthAlert;
import com.example.agentdeployer.monitoring.HealthCheckResult;
import com.example.agentdeployer.monitoring.HealthDetails;
import com.example.agentdeployer.monitoring.HealthMonitor;
import com.example.agentdeployer.monitoring.HealthMonitorConfig;
import com.example.agentdeployer.notification.NotificationService;
import com.example.agentdeployer.repository.ClientRepository;
import com.example.agentdeployer.repository.DeploymentAlertRepository;
import com.example.agentdeployer.repository.DeploymentRepository;
import com.example.agentdeployer.repository.HealthCheckRecordRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the health monitor for deployments, on demand and on a fixed schedule,
 * and owns everything the monitor itself does not keep: history, the health
 * snapshot on the deployment, alerts and notifications.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final HealthMonitor healthMonitor;
    private final DeploymentRepository deploymentRepository;
    private final ClientRepository clientRepository;
    private final HealthCheckRecordRepository healthCheckRecordRepository;
    private final DeploymentAlertRepository alertRepository;
    private final InstanceResolver instanceResolver;
    private final NotificationService notificationService;
    private final EventGatewayHandler eventGateway;
    private final DeployerProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Checks every live deployment. Failures of one check never stop the sweep.
     */
    @Scheduled(fixedDelayString = "#{${agent-deployer.monitoring.interval-minutes:5} * 60000}",
            initialDelayString = "#{${agent-deployer.monitoring.interval-minutes:5} * 60000}")
    public void runScheduledChecks() {
        if (!properties.getMonitoring().isEnabled()) return;

        List<Deployment> deployments = deploymentRepository.findByStatus(Deployment.DeploymentStatus.DEPLOYED);
        if (deployments.isEmpty()) return;

        log.info("Running scheduled health checks for {} deployment(s)", deployments.size());
        int unhealthy = 0;
        for (Deployment deployment : deployments) {
            if (deployment.isDemo()) {
                continue;
            }
            try {
                if (!check(deployment).healthy()) {
                    unhealthy++;
                }
            } catch (RuntimeException e) {
                log.error("Health check failed for deployment {}: {}", deployment.getId(), e.getMessage());
            }
        }
        log.info("Scheduled health checks done, {} unhealthy", unhealthy);
    }

    public HealthCheckResult checkNow(String deploymentId) {
        Deployment deployment = deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Deployment", deploymentId));
        if (deployment.isDemo()) {
            throw new IllegalStateException("Demo deployments have no n8n instance to check");
        }
        if (deployment.getWorkflowId() == null) {
            throw new IllegalStateException("Deployment " + deploymentId + " has no workflow yet");
        }
        return check(deployment);
    }

    HealthCheckResult check(Deployment deployment) {
        Client client = clientRepository.findById(deployment.getClientId()).orElse(null);
        N8nInstance instance = instanceResolver.resolve(deployment, client)
                .orElseThrow(() -> new IllegalStateException("n8n credentials missing for deployment " + deployment.getId()));

        HealthCheckResult result = healthMonitor.checkHealth(new HealthMonitorConfig(
                instance.url(), instance.apiKey(), deployment.getWorkflowId(),
                deployment.getId(), deployment.getClientId(), deployment.getAgentId()));

        record(deployment, result);
        List<HealthAlert> alerts = healthMonitor.generateAlerts(result);
        raiseAlerts(deployment, alerts);

        eventGateway.broadcast(EventGatewayHandler.HEALTH_CHECKED, result);
        return result;
    }

    void record(Deployment deployment, HealthCheckResult result) {
        HealthDetails details = result.details();
        healthCheckRecordRepository.save(HealthCheckRecord.builder()
                .deploymentId(deployment.getId())
                .timestamp(result.timestamp())
                .healthy(result.healthy())
                .overallStatus(result.healthy()
                        ? HealthCheckRecord.OverallStatus.HEALTHY : HealthCheckRecord.OverallStatus.ERROR)
                .workflowActive(details != null ? details.workflowActive() : null)
                .recentExecutions(details != null ? details.recentExecutions() : null)
                .successRate(details != null ? details.successRate() : null)
                .avgExecutionTimeMs(details != null ? details.avgExecutionTimeMs() : null)
                .latencyMs(result.latencyMs())
                .lastExecutionId(result.lastExecution() != null ? result.lastExecution().id() : null)
                .lastExecutionStatus(result.lastExecution() != null ? result.lastExecution().status() : null)
                .lastExecutionAt(result.lastExecution() != null ? result.lastExecution().startedAt() : null)
                .error(result.error())
                .build());

        boolean wasHealthy = deployment.isHealthy();
        int previousConsecutiveErrors = deployment.getConsecutiveErrors();

        if (!result.healthy() && result.error() != null) {
            List<HealthError> errors = new ArrayList<>(deployment.getRecentErrors());
            errors.add(HealthError.builder()
                    .timestamp(result.timestamp())
                    .message(result.error())
                    .type("health_check_failed")
                    .severity("error")
                    .build());
            int max = properties.getMonitoring().getMaxRecordedErrors();
            while (errors.size() > max) {
                errors.remove(0);
            }
            deployment.setRecentErrors(errors);
        }

        deployment.setLastHealthCheckAt(result.timestamp());
        deployment.setHealthy(result.healthy());
        deployment.setErrorCount(result.healthy() ? 0 : deployment.getErrorCount() + 1);
        deployment.setConsecutiveErrors(result.healthy() ? 0 : previousConsecutiveErrors + 1);
        if (result.lastExecution() != null) {
            deployment.setLastExecutionAt(result.lastExecution().startedAt());
            deployment.setLastExecutionStatus(summarizeStatus(result.lastExecution().status()));
        }
        deploymentRepository.save(deployment);

        if (!result.healthy()
                && (wasHealthy || previousConsecutiveErrors >= properties.getMonitoring().getNotifyAfterConsecutiveErrors())) {
            notificationService.notify(Notification.NotificationType.HEALTH_ALERT, Notification.Severity.ERROR,
                    "Health Check Failed: " + deployment.getWorkflowName(),
                    result.error() != null ? result.error() : "Unknown health check error",
                    deployment.getId());
        }
        if (wasHealthy != result.healthy()) {
            log.info("Deployment {} is now {}", deployment.getId(), result.healthy() ? "healthy" : "unhealthy");
        }
    }

    private void raiseAlerts(Deployment deployment, List<HealthAlert> alerts) {
        for (HealthAlert alert : alerts) {
            alertRepository.save(DeploymentAlert.builder()
                    .id(alert.id())
                    .deploymentId(alert.deploymentId())
                    .clientId(alert.clientId())
                    .agentId(alert.agentId())
                    .severity(alert.severity().wireName())
                    .type(alert.type().wireName())
                    .message(alert.message())
                    .timestamp(alert.timestamp())
                    .acknowledged(false)
                    .build());
            Counter.builder("deployer.health_check.alerts")
                    .tag("type", alert.type().wireName())
                    .register(meterRegistry)
                    .increment();
            log.warn("Alert [{}] {} for deployment {}: {}",
                    alert.severity().wireName(), alert.type().wireName(), deployment.getId(), alert.message());

            notificationService.sendAlert(alert, deployment.getWorkflowName());
            eventGateway.broadcast(EventGatewayHandler.HEALTH_ALERT, alert);
        }
    }

    private static String summarizeStatus(String executionStatus) {
        if ("success".equals(executionStatus)) return "success";
        if ("error".equals(executionStatus)) return "error";
        return "warning";
    }

    public List<HealthCheckRecord> getHistory(String deploymentId, Integer limit) {
        int size = limit != null && limit > 0 ? limit : properties.getMonitoring().getHistoryLimit();
        return healthCheckRecordRepository.findByDeploymentIdOrderByTimestampDesc(deploymentId, PageRequest.of(0, size));
    }

    public List<DeploymentAlert> getAlerts(String deploymentId) {
        return alertRepository.findByDeploymentIdOrderByTimestampDesc(deploymentId);
    }

    public List<DeploymentAlert> getOpenAlerts() {
        return alertRepository.findByAcknowledgedFalseOrderByTimestampDesc();
    }

    public DeploymentAlert acknowledge(String alertId) {
        DeploymentAlert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        if (!alert.isAcknowledged()) {
            alert.setAcknowledged(true);
            alert.setAcknowledgedAt(Instant.now());
            alert = alertRepository.save(alert);
        }
        return alert;
    }

    public Map<String, Object> summary() {
        List<Deployment> live = deploymentRepository.findByStatus(Deployment.DeploymentStatus.DEPLOYED);
        long healthy = live.stream().filter(Deployment::isHealthy).count();
        return Map.of(
                "deployed", live.size(),
                "healthy", healthy,
                "unhealthy", live.size() - healthy,
                "openAlerts", getOpenAlerts().size(),
                "eventSubscribers", eventGateway.getActiveSessionCount());
    }
}
