package com.example.agentdeployer.monitoring;

/**
 * @param successRate        0..100, 100 when there were no executions
 * @param avgExecutionTimeMs mean over executions with both timestamps, 0 when none
 */
public record HealthDetails(boolean workflowActive, int recentExecutions, int successRate, long avgExecutionTimeMs) {
}
