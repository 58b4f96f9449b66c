package com.example.agentdeployer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Central configuration for the deployer.
 * Maps to the 'agent-deployer' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "agent-deployer")
public class DeployerProperties {

    private ManagedInstanceConfig managedInstance = new ManagedInstanceConfig();
    private N8nConfig n8n = new N8nConfig();
    private RetryConfig retry = new RetryConfig();
    private DeploymentOptions deployment = new DeploymentOptions();
    private MonitoringConfig monitoring = new MonitoringConfig();
    private NotificationConfig notifications = new NotificationConfig();

    /** The operator's own n8n instance, used for "your instance" deployments. */
    @Data
    public static class ManagedInstanceConfig {
        private String url = "";
        private String apiKey = "";

        public boolean isConfigured() {
            return url != null && !url.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class N8nConfig {
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private int writeTimeoutSeconds = 30;
        private int clientCacheSize = 100;
        private int clientCacheTtlMinutes = 30;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialDelayMs = 1000;
        private long rateLimitDelayMs = 5000;
        private long maxDelayMs = 30000;
    }

    @Data
    public static class DeploymentOptions {
        private boolean demoModeEnabled = true;
        private int progressBufferSize = 64;
        private long progressRetentionMinutes = 30;
    }

    @Data
    public static class MonitoringConfig {
        private boolean enabled = true;
        private int intervalMinutes = 5;
        private int historyLimit = 20;
        private int maxRecordedErrors = 10;
        private int notifyAfterConsecutiveErrors = 3;
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }
}
