package com.example.agentdeployer.deployment;

import com.example.agentdeployer.n8n.ConnectionTestResult;
import com.example.agentdeployer.n8n.InstanceHealth;
import com.example.agentdeployer.n8n.N8nCredential;
import com.example.agentdeployer.n8n.N8nExecution;
import com.example.agentdeployer.n8n.RemoteAutomationClient;
import com.example.agentdeployer.n8n.WorkflowSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory n8n instance. Each operation can be scripted with a sequence of
 * outcomes: a null entry succeeds, an exception entry is thrown.
 */
class FakeAutomationClient implements RemoteAutomationClient {

    final List<String> calls = new ArrayList<>();
    final List<N8nCredential> createdCredentials = new ArrayList<>();
    JsonNode submittedWorkflow;
    ConnectionTestResult connection = ConnectionTestResult.ok(200);
    String workflowId = "wf-123";

    private final Map<String, List<RuntimeException>> script = new HashMap<>();
    private final Map<String, Integer> invocations = new HashMap<>();

    FakeAutomationClient script(String operation, RuntimeException... outcomes) {
        script.put(operation, new ArrayList<>(Arrays.asList(outcomes)));
        return this;
    }

    int count(String operation) {
        return invocations.getOrDefault(operation, 0);
    }

    private void invoke(String operation, String detail) {
        int n = invocations.merge(operation, 1, Integer::sum);
        calls.add(detail == null ? operation : operation + " " + detail);
        List<RuntimeException> outcomes = script.get(operation);
        if (outcomes != null && n <= outcomes.size() && outcomes.get(n - 1) != null) {
            throw outcomes.get(n - 1);
        }
    }

    @Override
    public String getBaseUrl() {
        return "https://n8n.example.com";
    }

    @Override
    public ConnectionTestResult testConnection() {
        invoke("testConnection", null);
        return connection;
    }

    @Override
    public N8nCredential createCredential(N8nCredential credential) {
        invoke("createCredential", credential.name());
        N8nCredential created = new N8nCredential("cred-" + (createdCredentials.size() + 1),
                credential.name(), credential.type(), null);
        createdCredentials.add(created);
        return created;
    }

    @Override
    public void deleteCredential(String id) {
        invoke("deleteCredential", id);
    }

    @Override
    public JsonNode createWorkflow(JsonNode workflow) {
        invoke("createWorkflow", null);
        submittedWorkflow = workflow;
        ObjectNode created = JsonNodeFactory.instance.objectNode();
        if (workflowId != null) {
            created.put("id", workflowId);
        }
        created.put("name", workflow.path("name").asText());
        return created;
    }

    @Override
    public JsonNode getWorkflow(String id) {
        throw new UnsupportedOperationException();
    }

    @Override
    public List<WorkflowSummary> listWorkflows(int limit) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void deleteWorkflow(String id) {
        invoke("deleteWorkflow", id);
    }

    @Override
    public JsonNode activateWorkflow(String id) {
        invoke("activateWorkflow", id);
        ObjectNode activated = JsonNodeFactory.instance.objectNode();
        activated.put("id", id);
        activated.put("active", true);
        return activated;
    }

    @Override
    public List<N8nExecution> getExecutions(String workflowId, int limit) {
        throw new UnsupportedOperationException();
    }

    @Override
    public InstanceHealth healthCheck() {
        throw new UnsupportedOperationException();
    }
}
