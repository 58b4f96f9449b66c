package com.example.agentdeployer.deployment;

import com.example.agentdeployer.credential.CredentialTypeRegistry;
import com.example.agentdeployer.n8n.ConnectionTestResult;
import com.example.agentdeployer.n8n.N8nApiException;
import com.example.agentdeployer.n8n.N8nClient;
import com.example.agentdeployer.n8n.N8nClientFactory;
import com.example.agentdeployer.n8n.N8nCredential;
import com.example.agentdeployer.n8n.RemoteAutomationClient;
import com.example.agentdeployer.n8n.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Provisions an agent onto an n8n instance.
 *
 * Pipeline: initializing, creating_credentials, generating_workflow, deploying,
 * activating, completed. Any failure rolls back what this attempt created
 * (workflow first, then credentials) and reports rolling_back then failed.
 * Every remote call goes through {@link RetryPolicy}.
 *
 * The engine is stateless; each call keeps its rollback manifest in its own {@link Attempt}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentEngine {

    private final N8nClientFactory clientFactory;
    private final RetryPolicy retryPolicy;
    private final WorkflowGenerator workflowGenerator;
    private final CredentialTypeRegistry credentialTypes;
    private final MeterRegistry meterRegistry;

    public DeploymentResult deploy(DeploymentConfig config, DeploymentProgressListener listener) {
        DeploymentProgressListener progress = listener != null ? listener : DeploymentProgressListener.NONE;
        Timer.Sample sample = Timer.start(meterRegistry);

        DeploymentResult result;
        try {
            RemoteAutomationClient client = clientFactory.forInstance(config.n8nUrl(), config.n8nApiKey());
            result = new Attempt(config, client, progress).run();
        } catch (IllegalArgumentException e) {
            // No client could be built, so nothing exists remotely to roll back.
            log.error("Deployment of agent {} to client {} rejected: {}", config.agentId(), config.clientId(), e.getMessage());
            publish(progress, new DeploymentProgress(DeploymentStage.FAILED, 0, "Deployment failed.", e.getMessage()),
                    config.agentId());
            result = DeploymentResult.failed(e.getMessage(), e.toString(), DeploymentErrorType.CONNECTION_FAILED);
        }

        sample.stop(Timer.builder("deployer.deployment.duration")
                .tag("outcome", result.success() ? "success" : "failure")
                .register(meterRegistry));
        return result;
    }

    /** Listener failures are logged and never change the outcome of the deployment. */
    private static void publish(DeploymentProgressListener listener, DeploymentProgress event, String agentId) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} for agent {}: {}", event.stage(), agentId, e.getMessage());
        }
    }

    static String workflowUrl(String baseUrl, String workflowId) {
        return N8nClient.normalizeBaseUrl(baseUrl) + "/workflow/" + workflowId;
    }

    /** Per-call state: the client, the listener and the rollback manifest. */
    private final class Attempt {

        private final DeploymentConfig config;
        private final RemoteAutomationClient client;
        private final DeploymentProgressListener progress;

        private final List<String> createdCredentialIds = new ArrayList<>();
        private String createdWorkflowId;
        private DeploymentStage stage = DeploymentStage.INITIALIZING;

        private Attempt(DeploymentConfig config, RemoteAutomationClient client, DeploymentProgressListener progress) {
            this.config = config;
            this.client = client;
            this.progress = progress;
        }

        DeploymentResult run() {
            log.info("Deploying agent {} to client {} at {}", config.agentId(), config.clientId(), client.getBaseUrl());
            try {
                emit(DeploymentStage.INITIALIZING, 5, "Testing connection to n8n instance...");
                verifyConnection();
                emit(DeploymentStage.INITIALIZING, 10, "Connection successful. Preparing deployment...");

                emit(DeploymentStage.CREATING_CREDENTIALS, 15, "Creating credentials in n8n...");
                CredentialBindings bindings = createCredentials();
                emit(DeploymentStage.CREATING_CREDENTIALS, 40,
                        "Created " + createdCredentialIds.size() + " credentials successfully.");

                emit(DeploymentStage.GENERATING_WORKFLOW, 50, "Generating workflow with credential bindings...");
                ObjectNode workflow = generateWorkflow(bindings);
                emit(DeploymentStage.GENERATING_WORKFLOW, 60, "Workflow generated successfully.");

                emit(DeploymentStage.DEPLOYING, 70, "Deploying workflow to n8n...");
                String workflowId = createWorkflow(workflow);
                emit(DeploymentStage.DEPLOYING, 85, "Workflow deployed successfully.");

                emit(DeploymentStage.ACTIVATING, 90, "Activating workflow...");
                activate(workflowId);

                emit(DeploymentStage.COMPLETED, 100, "Deployment completed successfully!");
                String url = workflowUrl(client.getBaseUrl(), workflowId);
                log.info("Deployed workflow {} for agent {} to client {} ({} credentials)",
                        workflowId, config.agentId(), config.clientId(), createdCredentialIds.size());
                return DeploymentResult.succeeded(workflowId, url, createdCredentialIds, oauthPendingTypes());
            } catch (DeploymentException e) {
                return fail(e);
            } catch (RuntimeException e) {
                return fail(new DeploymentException(stageErrorType(), e.getMessage(), e));
            }
        }

        private void verifyConnection() {
            ConnectionTestResult test;
            try {
                test = retryPolicy.execute("testConnection", () -> {
                    ConnectionTestResult attempt = client.testConnection();
                    if (!attempt.success() && attempt.failure() != null && attempt.failure().isRetryable()) {
                        throw attempt.failure();
                    }
                    return attempt;
                });
            } catch (N8nApiException e) {
                throw new DeploymentException(DeploymentErrorType.CONNECTION_FAILED,
                        "Failed to connect to n8n: " + e.getMessage(), e);
            }
            if (!test.success()) {
                throw new DeploymentException(DeploymentErrorType.CONNECTION_FAILED,
                        "Failed to connect to n8n: " + test.message(), test.failure());
            }
        }

        private CredentialBindings createCredentials() {
            CredentialBindings bindings = new CredentialBindings();
            List<CredentialInput> inputs = config.credentials();
            for (int i = 0; i < inputs.size(); i++) {
                CredentialInput input = inputs.get(i);
                emit(DeploymentStage.CREATING_CREDENTIALS, 15 + (int) Math.floor((double) i / inputs.size() * 25),
                        "Creating credential: " + input.name() + "...");

                N8nCredential created;
                try {
                    created = retryPolicy.execute("createCredential",
                            () -> client.createCredential(N8nCredential.of(input.name(), input.type(), input.data())));
                } catch (N8nApiException e) {
                    throw new DeploymentException(DeploymentErrorType.CREDENTIAL_CREATION_FAILED,
                            "Failed to create credential '" + input.name() + "': " + e.getMessage(), e);
                }
                if (created == null || created.id() == null || created.id().isBlank()) {
                    throw new DeploymentException(DeploymentErrorType.CREDENTIAL_CREATION_FAILED,
                            "n8n returned no id for credential '" + input.name() + "'");
                }

                createdCredentialIds.add(created.id());
                bindings.bind(new N8nCredential(created.id(),
                        created.name() != null ? created.name() : input.name(), input.type(), null));
                log.debug("Created credential {} ({}) as {}", input.name(), input.type(), created.id());
            }
            return bindings;
        }

        private ObjectNode generateWorkflow(CredentialBindings bindings) {
            try {
                return workflowGenerator.generate(config.templateJson(), config.workflowName(), bindings);
            } catch (IllegalArgumentException e) {
                throw new DeploymentException(DeploymentErrorType.WORKFLOW_CREATION_FAILED, e.getMessage(), e);
            }
        }

        private String createWorkflow(ObjectNode workflow) {
            JsonNode created;
            try {
                created = retryPolicy.execute("createWorkflow", () -> client.createWorkflow(workflow));
            } catch (N8nApiException e) {
                throw new DeploymentException(DeploymentErrorType.WORKFLOW_CREATION_FAILED,
                        "Failed to create workflow: " + e.getMessage(), e);
            }
            String id = created == null ? null : created.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new DeploymentException(DeploymentErrorType.WORKFLOW_CREATION_FAILED,
                        "n8n returned no id for the created workflow");
            }
            createdWorkflowId = id;
            return id;
        }

        private void activate(String workflowId) {
            try {
                retryPolicy.execute("activateWorkflow", () -> client.activateWorkflow(workflowId));
            } catch (N8nApiException e) {
                throw new DeploymentException(DeploymentErrorType.WORKFLOW_ACTIVATION_FAILED,
                        "Failed to activate workflow: " + e.getMessage(), e);
            }
        }

        private List<String> oauthPendingTypes() {
            Set<String> types = new LinkedHashSet<>();
            for (CredentialInput input : config.credentials()) {
                if (credentialTypes.requiresOAuth(input.type())) {
                    types.add(input.type());
                }
            }
            return List.copyOf(types);
        }

        private DeploymentResult fail(DeploymentException failure) {
            log.error("Deployment of agent {} to client {} failed: {}",
                    config.agentId(), config.clientId(), failure.getMessage());
            publish(new DeploymentProgress(DeploymentStage.ROLLING_BACK, 0,
                    "Deployment failed. Rolling back changes...", failure.getMessage()));

            rollback();

            publish(new DeploymentProgress(DeploymentStage.FAILED, 0,
                    "Deployment failed.", failure.getMessage()));
            Throwable detail = failure.getCause() != null ? failure.getCause() : failure;
            return DeploymentResult.failed(failure.getMessage(), detail.toString(), failure.getErrorType());
        }

        /** Best effort; individual delete failures are logged and never replace the original error. */
        private void rollback() {
            if (createdWorkflowId == null && createdCredentialIds.isEmpty()) {
                return;
            }
            Counter.builder("deployer.deployment.rollbacks").register(meterRegistry).increment();

            List<String> errors = new ArrayList<>();
            if (createdWorkflowId != null) {
                try {
                    retryPolicy.run("deleteWorkflow", () -> client.deleteWorkflow(createdWorkflowId));
                } catch (RuntimeException e) {
                    errors.add("Failed to delete workflow " + createdWorkflowId + ": " + e.getMessage());
                }
            }
            for (String credentialId : createdCredentialIds) {
                try {
                    retryPolicy.run("deleteCredential", () -> client.deleteCredential(credentialId));
                } catch (RuntimeException e) {
                    errors.add("Failed to delete credential " + credentialId + ": " + e.getMessage());
                }
            }

            if (errors.isEmpty()) {
                log.info("Rolled back workflow {} and {} credential(s)",
                        createdWorkflowId, createdCredentialIds.size());
            } else {
                errors.forEach(error -> log.warn("Rollback: {}", error));
                log.error("Rollback left {} resource(s) behind on {}", errors.size(), client.getBaseUrl());
            }
        }

        private DeploymentErrorType stageErrorType() {
            return switch (stage) {
                case INITIALIZING -> DeploymentErrorType.CONNECTION_FAILED;
                case CREATING_CREDENTIALS -> DeploymentErrorType.CREDENTIAL_CREATION_FAILED;
                case GENERATING_WORKFLOW, DEPLOYING -> DeploymentErrorType.WORKFLOW_CREATION_FAILED;
                default -> DeploymentErrorType.WORKFLOW_ACTIVATION_FAILED;
            };
        }

        private void emit(DeploymentStage stage, int percent, String message) {
            this.stage = stage;
            publish(DeploymentProgress.of(stage, percent, message));
        }

        private void publish(DeploymentProgress event) {
            DeploymentEngine.publish(progress, event, config.agentId());
        }
    }
}
