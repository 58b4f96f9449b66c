package com.example.agentdeployer.n8n;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Typed façade over the credential, workflow and execution resources of one
 * remote n8n instance.
 *
 * Mutating and read calls throw {@link N8nApiException} on failure.
 * {@link #testConnection()} and {@link #healthCheck()} report failure in their result instead.
 */
public interface RemoteAutomationClient {

    String getBaseUrl();

    /** Authenticated round trip against the workflows endpoint. */
    ConnectionTestResult testConnection();

    N8nCredential createCredential(N8nCredential credential);

    void deleteCredential(String id);

    /** Creates a workflow; the document must not carry an id. */
    JsonNode createWorkflow(JsonNode workflow);

    JsonNode getWorkflow(String id);

    List<WorkflowSummary> listWorkflows(int limit);

    void deleteWorkflow(String id);

    JsonNode activateWorkflow(String id);

    /** Most recent executions of a workflow, newest first. */
    List<N8nExecution> getExecutions(String workflowId, int limit);

    /** Unauthenticated liveness probe. */
    InstanceHealth healthCheck();
}
