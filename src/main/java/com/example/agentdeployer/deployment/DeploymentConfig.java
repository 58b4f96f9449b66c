package com.example.agentdeployer.deployment;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Immutable input to one deployment attempt.
 */
public record DeploymentConfig(
        String clientId,
        String agentId,
        String n8nUrl,
        String n8nApiKey,
        List<CredentialInput> credentials,
        JsonNode templateJson,
        String workflowName
) {

    public DeploymentConfig {
        credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    @Override
    public String toString() {
        return "DeploymentConfig[client=" + clientId + ", agent=" + agentId + ", n8nUrl=" + n8nUrl
                + ", credentials=" + credentials.size() + ", workflowName=" + workflowName + "]";
    }
}
