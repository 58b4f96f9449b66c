package com.example.agentdeployer.service;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.credential.CredentialSchema;
import com.example.agentdeployer.credential.SimpleCredential;
import com.example.agentdeployer.deployment.CredentialInput;
import com.example.agentdeployer.deployment.DeploymentConfig;
import com.example.agentdeployer.deployment.DeploymentEngine;
import com.example.agentdeployer.deployment.DeploymentProgress;
import com.example.agentdeployer.deployment.DeploymentResult;
import com.example.agentdeployer.deployment.DeploymentStage;
import com.example.agentdeployer.deployment.ProgressChannel;
import com.example.agentdeployer.domain.Agent;
import com.example.agentdeployer.domain.Client;
import com.example.agentdeployer.domain.Deployment;
import com.example.agentdeployer.domain.DeploymentType;
import com.example.agentdeployer.domain.Notification;
import com.example.agentdeployer.gateway.EventGatewayHandler;
import com.example.agentdeployer.notification.NotificationService;
import com.example.agentdeployer.repository.AgentRepository;
import com.example.agentdeployer.repository.ClientRepository;
import com.example.agentdeployer.repository.DeploymentRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Creates deployment records and runs the deployment engine for them in the
 * background, persisting the outcome and fanning progress out to pollers and
 * WebSocket subscribers.
 */
@Slf4j
@Service
public class DeploymentService {

    static final String DEMO_URL_PREFIX = "https://demo.n8n.cloud/workflow/";

    private final DeploymentRepository deploymentRepository;
    private final ClientRepository clientRepository;
    private final AgentRepository agentRepository;
    private final AgentService agentService;
    private final DeploymentEngine deploymentEngine;
    private final InstanceResolver instanceResolver;
    private final NotificationService notificationService;
    private final ActivityLogService activityLog;
    private final EventGatewayHandler eventGateway;
    private final DeployerProperties properties;
    private final Executor deploymentExecutor;

    private final Cache<String, ProgressChannel> progressChannels;

    public DeploymentService(DeploymentRepository deploymentRepository,
                             ClientRepository clientRepository,
                             AgentRepository agentRepository,
                             AgentService agentService,
                             DeploymentEngine deploymentEngine,
                             InstanceResolver instanceResolver,
                             NotificationService notificationService,
                             ActivityLogService activityLog,
                             EventGatewayHandler eventGateway,
                             DeployerProperties properties,
                             @Qualifier("deploymentExecutor") Executor deploymentExecutor) {
        this.deploymentRepository = deploymentRepository;
        this.clientRepository = clientRepository;
        this.agentRepository = agentRepository;
        this.agentService = agentService;
        this.deploymentEngine = deploymentEngine;
        this.instanceResolver = instanceResolver;
        this.notificationService = notificationService;
        this.activityLog = activityLog;
        this.eventGateway = eventGateway;
        this.properties = properties;
        this.deploymentExecutor = deploymentExecutor;
        this.progressChannels = Caffeine.newBuilder()
                .expireAfterAccess(properties.getDeployment().getProgressRetentionMinutes(), TimeUnit.MINUTES)
                .build();
    }

    /**
     * Records a new deployment, archiving any earlier one of the same agent to the
     * same client, and starts it in the background.
     */
    public Deployment start(DeploymentRequest request) {
        Client client = clientRepository.findById(request.clientId())
                .orElseThrow(() -> new ResourceNotFoundException("Client", request.clientId()));
        Agent agent = agentService.get(request.agentId());
        if (!agent.isActive()) {
            throw new IllegalStateException("Agent '" + agent.getName() + "' is inactive");
        }

        for (Deployment previous : deploymentRepository.findByClientIdAndAgentIdAndStatusNot(
                client.getId(), agent.getId(), Deployment.DeploymentStatus.ARCHIVED)) {
            if (previous.getStatus() == Deployment.DeploymentStatus.DEPLOYING) {
                throw new IllegalStateException("A deployment of this agent to this client is already running");
            }
            previous.setStatus(Deployment.DeploymentStatus.ARCHIVED);
            previous.setArchivedAt(Instant.now());
            deploymentRepository.save(previous);
            log.info("Archived deployment {} before re-deploying agent {} to client {}",
                    previous.getId(), agent.getId(), client.getId());
        }

        DeploymentType type = request.deploymentType() != null ? request.deploymentType() : client.getDeploymentType();
        String workflowName = request.workflowName() != null && !request.workflowName().isBlank()
                ? request.workflowName()
                : agent.getName() + " - " + client.getName();

        Deployment deployment = deploymentRepository.save(Deployment.builder()
                .clientId(client.getId())
                .agentId(agent.getId())
                .deploymentType(type)
                .n8nInstanceUrl(request.n8nUrl())
                .n8nApiKey(request.n8nApiKey())
                .workflowName(workflowName)
                .status(Deployment.DeploymentStatus.DEPLOYING)
                .deployedAt(Instant.now())
                .build());

        ProgressChannel channel = new ProgressChannel(properties.getDeployment().getProgressBufferSize());
        progressChannels.put(deployment.getId(), channel);
        activityLog.record(ActivityLogService.DEPLOYMENT, deployment.getId(), "deploying",
                "Started deploying " + agent.getName() + " to " + client.getName());

        List<CredentialInput> credentials = request.credentials();
        warnOnMissingCredentials(agent, credentials);
        String deploymentId = deployment.getId();
        deploymentExecutor.execute(() -> execute(deploymentId, credentials, channel));
        return deployment;
    }

    void execute(String deploymentId, List<CredentialInput> credentials, ProgressChannel channel) {
        Deployment deployment = deploymentRepository.findById(deploymentId).orElse(null);
        if (deployment == null) {
            log.error("Deployment {} vanished before it could run", deploymentId);
            return;
        }
        try {
            Client client = clientRepository.findById(deployment.getClientId()).orElse(null);
            Agent agent = agentRepository.findById(deployment.getAgentId())
                    .orElseThrow(() -> new ResourceNotFoundException("Agent", deployment.getAgentId()));

            Optional<N8nInstance> instance = instanceResolver.resolve(deployment, client);
            if (instance.isEmpty()) {
                if (deployment.getDeploymentType() == DeploymentType.CLIENT_INSTANCE) {
                    markFailed(deployment, channel,
                            "Missing client n8n credentials. Please provide n8n URL and API key.", null);
                } else if (properties.getDeployment().isDemoModeEnabled()) {
                    completeDemo(deployment, channel);
                } else {
                    markFailed(deployment, channel, "Managed n8n instance is not configured", null);
                }
                return;
            }

            DeploymentConfig config = new DeploymentConfig(
                    deployment.getClientId(),
                    deployment.getAgentId(),
                    instance.get().url(),
                    instance.get().apiKey(),
                    credentials,
                    agentService.template(agent),
                    deployment.getWorkflowName());

            DeploymentResult result = deploymentEngine.deploy(config, channel.andThen(progress ->
                    eventGateway.broadcast(EventGatewayHandler.DEPLOYMENT_PROGRESS,
                            Map.of("deploymentId", deploymentId, "progress", progress))));

            if (result.success()) {
                markDeployed(deployment, channel, result);
            } else {
                markFailed(deployment, channel, result.error(),
                        result.errorType() != null ? result.errorType().wireName() : null);
            }
        } catch (RuntimeException e) {
            log.error("Deployment {} failed unexpectedly", deploymentId, e);
            markFailed(deployment, channel, e.getMessage(), null);
        }
    }

    private void completeDemo(Deployment deployment, ProgressChannel channel) {
        String workflowId = "demo-" + System.currentTimeMillis();
        log.info("Deployment {} running in demo mode, no managed n8n instance configured", deployment.getId());
        channel.onProgress(new DeploymentProgress(DeploymentStage.COMPLETED, 100,
                "Deployed in DEMO MODE (no n8n credentials configured)", null));

        deployment.setDemo(true);
        deployment.setWorkflowId(workflowId);
        deployment.setWorkflowUrl(DEMO_URL_PREFIX + workflowId);
        finish(deployment, Deployment.DeploymentStatus.DEPLOYED, channel);

        activityLog.record(ActivityLogService.DEPLOYMENT, deployment.getId(), "deployed",
                "Deployed " + deployment.getWorkflowName() + " in demo mode");
        eventGateway.broadcast(EventGatewayHandler.DEPLOYMENT_COMPLETED, deployment);
    }

    private void markDeployed(Deployment deployment, ProgressChannel channel, DeploymentResult result) {
        deployment.setWorkflowId(result.workflowId());
        deployment.setWorkflowUrl(result.workflowUrl());
        deployment.setCredentialIds(new ArrayList<>(result.createdCredentialIds()));
        deployment.setOauthPendingTypes(new ArrayList<>(result.oauthPendingTypes()));
        deployment.setHealthy(true);
        finish(deployment, Deployment.DeploymentStatus.DEPLOYED, channel);

        String message = result.oauthPendingTypes().isEmpty()
                ? "Workflow " + result.workflowId() + " is live"
                : "Workflow " + result.workflowId() + " is live. Complete OAuth for: "
                + String.join(", ", result.oauthPendingTypes());
        notificationService.notify(Notification.NotificationType.DEPLOYMENT_SUCCESS, Notification.Severity.SUCCESS,
                "Deployed: " + deployment.getWorkflowName(), message, deployment.getId());
        activityLog.record(ActivityLogService.DEPLOYMENT, deployment.getId(), "deployed",
                "Deployed " + deployment.getWorkflowName(),
                Map.of("workflowId", result.workflowId(), "credentials", result.createdCredentialIds().size()));
        eventGateway.broadcast(EventGatewayHandler.DEPLOYMENT_COMPLETED, deployment);
    }

    private void markFailed(Deployment deployment, ProgressChannel channel, String error, String errorType) {
        if (channel.latest() == null || channel.latest().stage() != DeploymentStage.FAILED) {
            channel.onProgress(new DeploymentProgress(DeploymentStage.FAILED, 0, "Deployment failed.", error));
        }
        deployment.setDeploymentError(error);
        deployment.setErrorType(errorType);
        finish(deployment, Deployment.DeploymentStatus.FAILED, channel);

        notificationService.notify(Notification.NotificationType.DEPLOYMENT_FAILURE, Notification.Severity.ERROR,
                "Deployment failed: " + deployment.getWorkflowName(),
                error != null ? error : "Unknown deployment error", deployment.getId());
        activityLog.record(ActivityLogService.DEPLOYMENT, deployment.getId(), "failed",
                "Deployment of " + deployment.getWorkflowName() + " failed: " + error);
        eventGateway.broadcast(EventGatewayHandler.DEPLOYMENT_FAILED,
                Map.of("deploymentId", deployment.getId(), "error", String.valueOf(error)));
    }

    private void finish(Deployment deployment, Deployment.DeploymentStatus status, ProgressChannel channel) {
        deployment.setStatus(status);
        DeploymentProgress latest = channel.latest();
        if (latest != null) {
            deployment.setProgressStage(latest.stage().wireName());
            deployment.setProgressPercent(latest.percent());
            deployment.setProgressMessage(latest.message());
        }
        deploymentRepository.save(deployment);
        // restarts the retention window for pollers that have not drained yet
        progressChannels.asMap().replace(deployment.getId(), channel);
        log.info("Deployment {} finished as {}", deployment.getId(), status);
    }

    private void warnOnMissingCredentials(Agent agent, List<CredentialInput> supplied) {
        CredentialSchema schema = agentService.credentialSchema(agent);
        Set<String> suppliedTypes = supplied.stream().map(CredentialInput::type).collect(Collectors.toSet());
        List<String> missing = schema.simple().stream()
                .map(SimpleCredential::type)
                .filter(type -> !suppliedTypes.contains(type))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Deploying agent {} without credentials for {}", agent.getId(), missing);
        }
    }

    /** Buffered progress events since the last call; the latest stored stage once the channel is gone. */
    public List<DeploymentProgress> drainProgress(String deploymentId) {
        Deployment deployment = get(deploymentId);
        ProgressChannel channel = progressChannels.getIfPresent(deploymentId);
        if (channel == null) {
            if (deployment.getProgressStage() == null) {
                return List.of();
            }
            return List.of(new DeploymentProgress(DeploymentStage.valueOf(deployment.getProgressStage().toUpperCase(Locale.ROOT)),
                    deployment.getProgressPercent() != null ? deployment.getProgressPercent() : 0,
                    deployment.getProgressMessage(), deployment.getDeploymentError()));
        }
        List<DeploymentProgress> events = channel.drain();
        if (channel.isFinished() && deployment.getStatus() != Deployment.DeploymentStatus.DEPLOYING) {
            progressChannels.asMap().remove(deploymentId, channel);
        }
        return events;
    }

    long retainedProgressChannels() {
        progressChannels.cleanUp();
        return progressChannels.estimatedSize();
    }

    public List<Deployment> list() {
        return deploymentRepository.findAllByOrderByDeployedAtDesc();
    }

    public List<Deployment> listByClient(String clientId) {
        return deploymentRepository.findByClientIdOrderByDeployedAtDesc(clientId);
    }

    public Deployment get(String id) {
        return deploymentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Deployment", id));
    }

    /** Pauses a deployed deployment or resumes a paused one. Only the stored status changes. */
    public Deployment toggleActive(String id) {
        Deployment deployment = get(id);
        String action;
        switch (deployment.getStatus()) {
            case DEPLOYED -> {
                deployment.setStatus(Deployment.DeploymentStatus.PAUSED);
                action = "paused";
            }
            case PAUSED -> {
                deployment.setStatus(Deployment.DeploymentStatus.DEPLOYED);
                action = "resumed";
            }
            default -> throw new IllegalStateException(
                    "Only deployed or paused deployments can be toggled, status is " + deployment.getStatus());
        }
        Deployment saved = deploymentRepository.save(deployment);
        activityLog.record(ActivityLogService.DEPLOYMENT, id, action,
                (action.equals("paused") ? "Paused " : "Resumed ") + deployment.getWorkflowName());
        return saved;
    }
}
