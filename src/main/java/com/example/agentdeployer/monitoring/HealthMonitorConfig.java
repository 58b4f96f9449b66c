package com.example.agentdeployer.monitoring;

/**
 * What to check and where: one deployed workflow on one n8n instance.
 */
public record HealthMonitorConfig(
        String n8nUrl,
        String n8nApiKey,
        String workflowId,
        String deploymentId,
        String clientId,
        String agentId
) {

    @Override
    public String toString() {
        return "HealthMonitorConfig[n8nUrl=" + n8nUrl + ", workflowId=" + workflowId
                + ", deploymentId=" + deploymentId + "]";
    }
}
