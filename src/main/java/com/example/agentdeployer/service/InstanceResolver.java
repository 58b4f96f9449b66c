package com.example.agentdeployer.service;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.domain.Client;
import com.example.agentdeployer.domain.Deployment;
import com.example.agentdeployer.domain.DeploymentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Works out which n8n instance a deployment targets. Client-instance deployments
 * use the URL and key entered with the deployment, falling back to the client's;
 * your-instance deployments use the managed instance from configuration.
 */
@Component
@RequiredArgsConstructor
public class InstanceResolver {

    private final DeployerProperties properties;

    public Optional<N8nInstance> resolve(Deployment deployment, Client client) {
        if (deployment.getDeploymentType() == DeploymentType.YOUR_INSTANCE) {
            DeployerProperties.ManagedInstanceConfig managed = properties.getManagedInstance();
            return managed.isConfigured()
                    ? Optional.of(new N8nInstance(managed.getUrl(), managed.getApiKey()))
                    : Optional.empty();
        }

        String url = firstNonBlank(deployment.getN8nInstanceUrl(), client != null ? client.getN8nInstanceUrl() : null);
        String apiKey = firstNonBlank(deployment.getN8nApiKey(), client != null ? client.getN8nApiKey() : null);
        return url != null && apiKey != null ? Optional.of(new N8nInstance(url, apiKey)) : Optional.empty();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
