package com.example.agentdeployer.service;

import com.example.agentdeployer.deployment.CredentialInput;
import com.example.agentdeployer.domain.DeploymentType;

import java.util.List;

/**
 * Request to deploy an agent to a client.
 *
 * @param deploymentType defaults to the client's deployment type when null
 * @param workflowName   defaults to {@code "<agent> - <client>"} when blank
 */
public record DeploymentRequest(
        String clientId,
        String agentId,
        DeploymentType deploymentType,
        String n8nUrl,
        String n8nApiKey,
        String workflowName,
        List<CredentialInput> credentials
) {

    public DeploymentRequest {
        credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    @Override
    public String toString() {
        return "DeploymentRequest[client=" + clientId + ", agent=" + agentId + ", type=" + deploymentType
                + ", n8nUrl=" + n8nUrl + ", credentials=" + credentials.size() + "]";
    }
}
