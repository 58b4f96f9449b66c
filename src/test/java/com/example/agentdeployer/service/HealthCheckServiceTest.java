package com.example.agentdeployer.service;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.domain.Deployment;
import com.example.agentdeployer.domain.DeploymentAlert;
import com.example.agentdeployer.domain.DeploymentType;
import com.example.agentdeployer.domain.HealthCheckRecord;
import com.example.agentdeployer.domain.Notification;
import com.example.agentdeployer.gateway.EventGatewayHandler;
import com.example.agentdeployer.monitoring.AlertSeverity;
import com.example.agentdeployer.monitoring.AlertType;
import com.example.agentdeployer.monitoring.HealthAlert;
import com.example.agentdeployer.monitoring.HealthCheckResult;
import com.example.agentdeployer.monitoring.HealthDetails;
import com.example.agentdeployer.monitoring.HealthMonitor;
import com.example.agentdeployer.monitoring.HealthMonitorConfig;
import com.example.agentdeployer.monitoring.LastExecution;
import com.example.agentdeployer.notification.NotificationService;
import com.example.agentdeployer.repository.ClientRepository;
import com.example.agentdeployer.repository.DeploymentAlertRepository;
import com.example.agentdeployer.repository.DeploymentRepository;
import com.example.agentdeployer.repository.HealthCheckRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private HealthMonitor healthMonitor;
    private DeploymentRepository deploymentRepository;
    private HealthCheckRecordRepository recordRepository;
    private DeploymentAlertRepository alertRepository;
    private NotificationService notificationService;
    private DeployerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private HealthCheckService service;

    private Deployment deployment;

    @BeforeEach
    void setUp() {
        healthMonitor = mock(HealthMonitor.class);
        deploymentRepository = mock(DeploymentRepository.class);
        recordRepository = mock(HealthCheckRecordRepository.class);
        alertRepository = mock(DeploymentAlertRepository.class);
        notificationService = mock(NotificationService.class);
        ClientRepository clientRepository = mock(ClientRepository.class);
        properties = new DeployerProperties();
        meterRegistry = new SimpleMeterRegistry();

        deployment = Deployment.builder().id("dep-1").clientId("client-1").agentId("agent-1")
                .deploymentType(DeploymentType.CLIENT_INSTANCE)
                .n8nInstanceUrl("https://n8n.acme.io").n8nApiKey("acme-key")
                .workflowId("wf-1").workflowName("Inbox Digest - Acme")
                .status(Deployment.DeploymentStatus.DEPLOYED).build();

        when(deploymentRepository.findById("dep-1")).thenReturn(Optional.of(deployment));
        when(clientRepository.findById(anyString())).thenReturn(Optional.empty());
        when(deploymentRepository.save(any(Deployment.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(alertRepository.save(any(DeploymentAlert.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service = new HealthCheckService(healthMonitor, deploymentRepository, clientRepository, recordRepository,
                alertRepository, new InstanceResolver(properties), notificationService,
                mock(EventGatewayHandler.class), properties, meterRegistry);
    }

    private static HealthCheckResult healthy() {
        return new HealthCheckResult("dep-1", "wf-1", "client-1", "agent-1", true, NOW, 40L,
                new LastExecution("e1", "success", NOW.minusSeconds(60), NOW.minusSeconds(58)), null,
                new HealthDetails(true, 10, 100, 2000));
    }

    private static HealthCheckResult unreachable() {
        return new HealthCheckResult("dep-1", "wf-1", "client-1", "agent-1", false, NOW, null, null,
                "n8n instance is unreachable: Connection refused", null);
    }

    private void verifyHealthNotifications(int count) {
        verify(notificationService, times(count)).notify(eq(Notification.NotificationType.HEALTH_ALERT),
                eq(Notification.Severity.ERROR), anyString(), anyString(), eq("dep-1"));
    }

    @Test
    void firstFailureAfterHealthyNotifies() {
        service.record(deployment, unreachable());

        assertFalse(deployment.isHealthy());
        assertEquals(1, deployment.getConsecutiveErrors());
        assertEquals(1, deployment.getRecentErrors().size());
        assertEquals("n8n instance is unreachable: Connection refused", deployment.getRecentErrors().get(0).getMessage());
        verifyHealthNotifications(1);
    }

    @Test
    void repeatedFailuresNotifyAgainAfterThreshold() {
        service.record(deployment, unreachable());
        service.record(deployment, unreachable());
        service.record(deployment, unreachable());
        verifyHealthNotifications(1);

        service.record(deployment, unreachable());
        assertEquals(4, deployment.getConsecutiveErrors());
        verifyHealthNotifications(2);
    }

    @Test
    void recoveryResetsCounters() {
        service.record(deployment, unreachable());
        service.record(deployment, healthy());

        assertTrue(deployment.isHealthy());
        assertEquals(0, deployment.getConsecutiveErrors());
        assertEquals(0, deployment.getErrorCount());
        assertEquals("success", deployment.getLastExecutionStatus());
        assertEquals(NOW, deployment.getLastHealthCheckAt());
    }

    @Test
    void recentErrorsAreCapped() {
        properties.getMonitoring().setMaxRecordedErrors(2);

        for (int i = 0; i < 5; i++) {
            service.record(deployment, unreachable());
        }

        assertEquals(2, deployment.getRecentErrors().size());
        assertEquals(5, deployment.getErrorCount());
    }

    @Test
    void unfinishedExecutionIsSummarizedAsWarning() {
        HealthCheckResult running = new HealthCheckResult("dep-1", "wf-1", "client-1", "agent-1", true, NOW, 40L,
                new LastExecution("e2", "running", NOW, null), null, new HealthDetails(true, 10, 90, 2000));

        service.record(deployment, running);

        assertEquals("warning", deployment.getLastExecutionStatus());
    }

    @Test
    void everyCheckIsRecorded() {
        service.record(deployment, unreachable());

        ArgumentCaptor<HealthCheckRecord> record = ArgumentCaptor.forClass(HealthCheckRecord.class);
        verify(recordRepository).save(record.capture());
        assertEquals("dep-1", record.getValue().getDeploymentId());
        assertEquals(HealthCheckRecord.OverallStatus.ERROR, record.getValue().getOverallStatus());
        assertNull(record.getValue().getSuccessRate());
    }

    @Test
    void checkPersistsAndDispatchesAlerts() {
        HealthAlert alert = new HealthAlert("alert-1", "dep-1", "client-1", "agent-1", AlertSeverity.CRITICAL,
                AlertType.CONNECTION_LOST, "Cannot reach n8n instance", NOW, false);
        when(healthMonitor.checkHealth(any(HealthMonitorConfig.class))).thenReturn(unreachable());
        when(healthMonitor.generateAlerts(any(HealthCheckResult.class))).thenReturn(List.of(alert));

        HealthCheckResult result = service.checkNow("dep-1");

        assertFalse(result.healthy());
        ArgumentCaptor<HealthMonitorConfig> config = ArgumentCaptor.forClass(HealthMonitorConfig.class);
        verify(healthMonitor).checkHealth(config.capture());
        assertEquals("https://n8n.acme.io", config.getValue().n8nUrl());
        assertEquals("wf-1", config.getValue().workflowId());

        ArgumentCaptor<DeploymentAlert> saved = ArgumentCaptor.forClass(DeploymentAlert.class);
        verify(alertRepository).save(saved.capture());
        assertEquals("alert-1", saved.getValue().getId());
        assertEquals("critical", saved.getValue().getSeverity());
        assertEquals("connection_lost", saved.getValue().getType());
        verify(notificationService).sendAlert(alert, "Inbox Digest - Acme");
        assertEquals(1.0, meterRegistry.counter("deployer.health_check.alerts", "type", "connection_lost").count());
    }

    @Test
    void demoDeploymentCannotBeChecked() {
        deployment.setDemo(true);

        assertThrows(IllegalStateException.class, () -> service.checkNow("dep-1"));
        verify(healthMonitor, never()).checkHealth(any());
    }

    @Test
    void deploymentWithoutWorkflowCannotBeChecked() {
        deployment.setWorkflowId(null);

        assertThrows(IllegalStateException.class, () -> service.checkNow("dep-1"));
    }

    @Test
    void sweepSkipsDemoAndSurvivesFailures() {
        Deployment demo = Deployment.builder().id("dep-demo").clientId("client-1").agentId("agent-1")
                .deploymentType(DeploymentType.YOUR_INSTANCE).workflowId("demo-1").workflowName("Demo")
                .demo(true).status(Deployment.DeploymentStatus.DEPLOYED).build();
        Deployment broken = Deployment.builder().id("dep-2").clientId("client-1").agentId("agent-1")
                .deploymentType(DeploymentType.CLIENT_INSTANCE).workflowId("wf-2").workflowName("No Settings")
                .status(Deployment.DeploymentStatus.DEPLOYED).build();
        when(deploymentRepository.findByStatus(Deployment.DeploymentStatus.DEPLOYED))
                .thenReturn(List.of(demo, broken, deployment));
        when(healthMonitor.checkHealth(any(HealthMonitorConfig.class))).thenReturn(healthy());
        when(healthMonitor.generateAlerts(any(HealthCheckResult.class))).thenReturn(List.of());

        service.runScheduledChecks();

        verify(healthMonitor, times(1)).checkHealth(any(HealthMonitorConfig.class));
        assertTrue(deployment.isHealthy());
        assertNull(demo.getLastHealthCheckAt());
    }

    @Test
    void sweepDoesNothingWhenDisabled() {
        properties.getMonitoring().setEnabled(false);

        service.runScheduledChecks();

        verify(deploymentRepository, never()).findByStatus(any());
    }

    @Test
    void acknowledgeMarksAlert() {
        DeploymentAlert alert = DeploymentAlert.builder().id("alert-1").deploymentId("dep-1")
                .severity("warning").type("workflow_inactive").message("Workflow is not active").timestamp(NOW).build();
        when(alertRepository.findById("alert-1")).thenReturn(Optional.of(alert));

        DeploymentAlert acknowledged = service.acknowledge("alert-1");

        assertTrue(acknowledged.isAcknowledged());
        assertNotNull(acknowledged.getAcknowledgedAt());
    }

    @Test
    void acknowledgingUnknownAlertFails() {
        when(alertRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.acknowledge("nope"));
    }
}
