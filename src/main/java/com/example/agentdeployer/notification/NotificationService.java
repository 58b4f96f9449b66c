package com.example.agentdeployer.notification;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.domain.Notification;
import com.example.agentdeployer.monitoring.AlertSeverity;
import com.example.agentdeployer.monitoring.HealthAlert;
import com.example.agentdeployer.repository.NotificationRepository;
import com.example.agentdeployer.service.ResourceNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operator notifications: stored in-app, and critical health alerts also go to Slack.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final MediaType JSON = MediaType.get("application/json");

    private final NotificationRepository notificationRepository;
    private final DeployerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public Notification notify(Notification.NotificationType type, Notification.Severity severity,
                               String title, String message, String deploymentId) {
        Notification notification = Notification.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .message(message)
                .relatedEntityType(deploymentId != null ? "deployment" : null)
                .relatedEntityId(deploymentId)
                .createdAt(Instant.now())
                .build();
        Notification saved = notificationRepository.save(notification);
        log.info("Notification [{}] {}: {}", severity, title, message);
        return saved;
    }

    /**
     * Sends a critical alert to Slack when the webhook is configured. Other severities are ignored.
     */
    @Async("notificationExecutor")
    public void sendAlert(HealthAlert alert, String workflowName) {
        if (alert.severity() != AlertSeverity.CRITICAL) {
            return;
        }
        if (!properties.getNotifications().getSlack().isEnabled()) {
            return;
        }
        sendSlackNotification(String.format(":rotating_light: *[%s] %s*\nWorkflow: %s\nDeployment: %s\n%s",
                alert.severity().wireName().toUpperCase(), alert.type().wireName(), workflowName,
                alert.deploymentId(), alert.message()));
    }

    public void sendSlackNotification(String text) {
        String webhookUrl = properties.getNotifications().getSlack().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            log.warn("Slack webhook URL not configured");
            return;
        }

        try {
            Map<String, Object> payload = Map.of(
                    "text", text,
                    "username", "Agent Deployer",
                    "icon_emoji", ":robot_face:"
            );
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("Slack notification sent");
                } else {
                    log.error("Slack notification failed: {}", response.code());
                }
            }
        } catch (IOException e) {
            log.error("Failed to send Slack notification: {}", e.getMessage());
        }
    }

    public List<Notification> getRecent(int limit) {
        return notificationRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
    }

    public long getUnreadCount() {
        return notificationRepository.countByReadFalse();
    }

    @Transactional
    public Notification markRead(String id) {
        Notification notification = notificationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", id));
        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(Instant.now());
            notification = notificationRepository.save(notification);
        }
        return notification;
    }

    @Transactional
    public int markAllRead() {
        List<Notification> unread = notificationRepository.findByReadFalse();
        Instant now = Instant.now();
        unread.forEach(n -> {
            n.setRead(true);
            n.setReadAt(now);
        });
        notificationRepository.saveAll(unread);
        return unread.size();
    }
}
