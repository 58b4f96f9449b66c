package com.example.agentdeployer.deployment;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.credential.CredentialTypeRegistry;
import com.example.agentdeployer.n8n.ConnectionTestResult;
import com.example.agentdeployer.n8n.N8nApiException;
import com.example.agentdeployer.n8n.N8nClientFactory;
import com.example.agentdeployer.n8n.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeploymentEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<DeploymentProgress> events = new ArrayList<>();

    private FakeAutomationClient n8n;
    private N8nClientFactory clientFactory;
    private SimpleMeterRegistry meterRegistry;
    private DeploymentEngine engine;

    @BeforeEach
    void setUp() {
        n8n = new FakeAutomationClient();
        clientFactory = mock(N8nClientFactory.class);
        when(clientFactory.forInstance(anyString(), anyString())).thenReturn(n8n);

        DeployerProperties.RetryConfig retry = new DeployerProperties.RetryConfig();
        retry.setMaxRetries(2);
        meterRegistry = new SimpleMeterRegistry();
        engine = new DeploymentEngine(clientFactory, new RetryPolicy(retry, meterRegistry, millis -> { }),
                new WorkflowGenerator(), new CredentialTypeRegistry(), meterRegistry);
    }

    private JsonNode template() throws Exception {
        return mapper.readTree("""
                {"id": "template-1", "name": "Inbox Digest", "active": true,
                 "nodes": [
                   {"name": "Gmail", "type": "n8n-nodes-base.gmail",
                    "credentials": {"googleApi": {"id": "old-1", "name": "Google"}}},
                   {"name": "Slack", "type": "n8n-nodes-base.slack",
                    "credentials": {"slackApi": {"id": "old-2", "name": "Slack"}}}
                 ],
                 "connections": {}}
                """);
    }

    private DeploymentConfig config(JsonNode template) {
        return new DeploymentConfig("client-1", "agent-1", "https://n8n.example.com/", "key",
                List.of(new CredentialInput("googleApi", "Acme Google", Map.of("serviceAccount", "sa@acme.io")),
                        new CredentialInput("slackApi", "Acme Slack", Map.of("accessToken", "xoxb-1"))),
                template, "Inbox Digest - Acme");
    }

    private List<DeploymentStage> stages() {
        return events.stream().map(DeploymentProgress::stage).toList();
    }

    @Test
    void deploysWorkflowEndToEnd() throws Exception {
        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertTrue(result.success());
        assertEquals("wf-123", result.workflowId());
        assertEquals("https://n8n.example.com/workflow/wf-123", result.workflowUrl());
        assertEquals(List.of("cred-1", "cred-2"), result.createdCredentialIds());
        assertNull(result.errorType());
        assertEquals(List.of("testConnection", "createCredential Acme Google", "createCredential Acme Slack",
                "createWorkflow", "activateWorkflow wf-123"), n8n.calls);

        JsonNode sent = n8n.submittedWorkflow;
        assertEquals("Inbox Digest - Acme", sent.get("name").asText());
        assertFalse(sent.get("active").asBoolean());
        assertFalse(sent.has("id"));
        assertEquals("cred-1", sent.at("/nodes/0/credentials/googleApi/id").asText());
        assertEquals("Google", sent.at("/nodes/0/credentials/googleApi/name").asText());
        assertEquals("cred-2", sent.at("/nodes/1/credentials/slackApi/id").asText());
    }

    @Test
    void reportsProgressInOrder() throws Exception {
        engine.deploy(config(template()), events::add);

        List<Integer> percents = events.stream().map(DeploymentProgress::percent).toList();
        assertEquals(List.of(5, 10, 15, 15, 27, 40, 50, 60, 70, 85, 90, 100), percents);
        assertEquals(DeploymentStage.COMPLETED, events.get(events.size() - 1).stage());
        assertEquals("Creating credential: Acme Slack...", events.get(4).message());
        assertFalse(stages().contains(DeploymentStage.ROLLING_BACK));
    }

    @Test
    void reportsOAuthTypesStillPendingConsent() throws Exception {
        DeploymentConfig config = new DeploymentConfig("client-1", "agent-1", "https://n8n.example.com", "key",
                List.of(new CredentialInput("googleSheetsOAuth2Api", "Sheets", Map.of("clientId", "id", "clientSecret", "s")),
                        new CredentialInput("slackApi", "Slack", Map.of("accessToken", "xoxb-1"))),
                template(), "Inbox Digest");

        DeploymentResult result = engine.deploy(config, null);

        assertTrue(result.success());
        assertEquals(List.of("googleSheetsOAuth2Api"), result.oauthPendingTypes());
    }

    @Test
    void connectionFailureCreatesNothing() throws Exception {
        n8n.connection = ConnectionTestResult.failed("Invalid API key", new N8nApiException(401, "Invalid API key"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertFalse(result.success());
        assertEquals(DeploymentErrorType.CONNECTION_FAILED, result.errorType());
        assertEquals("Failed to connect to n8n: Invalid API key", result.error());
        assertEquals(List.of("testConnection"), n8n.calls);
        assertEquals(List.of(DeploymentStage.INITIALIZING, DeploymentStage.ROLLING_BACK, DeploymentStage.FAILED), stages());
        assertEquals(0.0, meterRegistry.counter("deployer.deployment.rollbacks").count());
    }

    @Test
    void unreachableInstanceIsRetriedBeforeFailing() throws Exception {
        n8n.connection = ConnectionTestResult.failed("Connection failed: 503 Service Unavailable",
                new N8nApiException(503, "Service Unavailable"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertEquals(DeploymentErrorType.CONNECTION_FAILED, result.errorType());
        assertEquals(3, n8n.count("testConnection"));
    }

    @Test
    void credentialFailureRollsBackEarlierCredentials() throws Exception {
        n8n.script("createCredential", null, new N8nApiException(400, "Invalid credential data"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertFalse(result.success());
        assertEquals(DeploymentErrorType.CREDENTIAL_CREATION_FAILED, result.errorType());
        assertEquals("Failed to create credential 'Acme Slack': Invalid credential data", result.error());
        assertTrue(result.createdCredentialIds().isEmpty());
        assertEquals(List.of("testConnection", "createCredential Acme Google", "createCredential Acme Slack",
                "deleteCredential cred-1"), n8n.calls);
        assertEquals(DeploymentStage.FAILED, events.get(events.size() - 1).stage());
        assertEquals(1.0, meterRegistry.counter("deployer.deployment.rollbacks").count());
    }

    @Test
    void generationFailureRollsBackCredentials() throws Exception {
        DeploymentResult result = engine.deploy(config(mapper.readTree("[1, 2]")), events::add);

        assertEquals(DeploymentErrorType.WORKFLOW_CREATION_FAILED, result.errorType());
        assertEquals(0, n8n.count("createWorkflow"));
        assertTrue(n8n.calls.containsAll(List.of("deleteCredential cred-1", "deleteCredential cred-2")));
    }

    @Test
    void workflowCreationFailureRollsBackCredentials() throws Exception {
        n8n.script("createWorkflow", new N8nApiException(400, "request/body/nodes must be array"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertEquals(DeploymentErrorType.WORKFLOW_CREATION_FAILED, result.errorType());
        assertEquals("Failed to create workflow: request/body/nodes must be array", result.error());
        assertEquals(0, n8n.count("deleteWorkflow"));
        assertEquals(2, n8n.count("deleteCredential"));
    }

    @Test
    void workflowWithoutIdRollsBackCredentialsOnly() throws Exception {
        n8n.workflowId = null;

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertFalse(result.success());
        assertEquals(DeploymentErrorType.WORKFLOW_CREATION_FAILED, result.errorType());
        assertEquals(List.of("deleteCredential cred-1", "deleteCredential cred-2"),
                n8n.calls.subList(4, n8n.calls.size()));
        assertEquals(0, n8n.count("deleteWorkflow"));
        assertEquals(0, n8n.count("activateWorkflow"));
    }

    @Test
    void transientWorkflowCreationFailureIsRetried() throws Exception {
        n8n.script("createWorkflow", new N8nApiException(503, "Service Unavailable"),
                new N8nApiException(502, "Bad Gateway"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertTrue(result.success());
        assertEquals(3, n8n.count("createWorkflow"));
    }

    @Test
    void activationFailureDeletesWorkflowBeforeCredentials() throws Exception {
        n8n.script("activateWorkflow", new N8nApiException(400, "Workflow has no trigger node"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertEquals(DeploymentErrorType.WORKFLOW_ACTIVATION_FAILED, result.errorType());
        assertEquals("Failed to activate workflow: Workflow has no trigger node", result.error());
        List<String> rollback = n8n.calls.subList(5, n8n.calls.size());
        assertEquals(List.of("deleteWorkflow wf-123", "deleteCredential cred-1", "deleteCredential cred-2"), rollback);

        DeploymentProgress rollingBack = events.get(events.size() - 2);
        assertEquals(DeploymentStage.ROLLING_BACK, rollingBack.stage());
        assertEquals("Failed to activate workflow: Workflow has no trigger node", rollingBack.detail());
    }

    @Test
    void rollbackFailureKeepsOriginalError() throws Exception {
        n8n.script("activateWorkflow", new N8nApiException(400, "Workflow has no trigger node"));
        n8n.script("deleteWorkflow", new N8nApiException(404, "Not Found"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertEquals(DeploymentErrorType.WORKFLOW_ACTIVATION_FAILED, result.errorType());
        assertEquals("Failed to activate workflow: Workflow has no trigger node", result.error());
        assertEquals(2, n8n.count("deleteCredential"));
    }

    @Test
    void throwingListenerDoesNotSkipRollback() throws Exception {
        n8n.script("activateWorkflow", new N8nApiException(400, "Workflow has no trigger node"));
        DeploymentProgressListener listener = progress -> {
            if (progress.stage() == DeploymentStage.ROLLING_BACK) {
                throw new IllegalStateException("subscriber buffer full");
            }
            events.add(progress);
        };

        DeploymentResult result = engine.deploy(config(template()), listener);

        assertEquals(DeploymentErrorType.WORKFLOW_ACTIVATION_FAILED, result.errorType());
        assertEquals(List.of("deleteWorkflow wf-123", "deleteCredential cred-1", "deleteCredential cred-2"),
                n8n.calls.subList(5, n8n.calls.size()));
        assertEquals(DeploymentStage.FAILED, events.get(events.size() - 1).stage());
    }

    @Test
    void throwingListenerDoesNotFailSuccessfulDeploy() throws Exception {
        DeploymentResult result = engine.deploy(config(template()), progress -> {
            throw new IllegalStateException("subscriber buffer full");
        });

        assertTrue(result.success());
        assertEquals("wf-123", result.workflowId());
        assertEquals(0, n8n.count("deleteWorkflow"));
        assertEquals(0, n8n.count("deleteCredential"));
    }

    @Test
    void missingInstanceSettingsFailAsConnectionError() throws Exception {
        when(clientFactory.forInstance(anyString(), anyString()))
                .thenThrow(new IllegalArgumentException("n8n API key is required"));

        DeploymentResult result = engine.deploy(config(template()), events::add);

        assertEquals(DeploymentErrorType.CONNECTION_FAILED, result.errorType());
        assertEquals("n8n API key is required", result.error());
        assertEquals(List.of(DeploymentStage.FAILED), stages());
        assertTrue(n8n.calls.isEmpty());
    }

    @Test
    void recordsDurationByOutcome() throws Exception {
        engine.deploy(config(template()), null);

        assertEquals(1L, meterRegistry.timer("deployer.deployment.duration", "outcome", "success").count());
    }

    @Test
    void workflowUrlIgnoresTrailingSlash() {
        assertEquals("https://n8n.acme.io/workflow/42", DeploymentEngine.workflowUrl("https://n8n.acme.io/", "42"));
    }
}
