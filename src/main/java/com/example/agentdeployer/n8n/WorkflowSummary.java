package com.example.agentdeployer.n8n;

/** Workflow listing entry for the template picker. */
public record WorkflowSummary(String id, String name, boolean active, String createdAt, String updatedAt) {
}
