package com.example.agentdeployer.deployment;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Terminal value of one deployment attempt.
 *
 * @param oauthPendingTypes credential types that still need the OAuth consent step in n8n
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentResult(
        boolean success,
        String workflowId,
        String workflowUrl,
        List<String> createdCredentialIds,
        String error,
        String errorDetail,
        DeploymentErrorType errorType,
        List<String> oauthPendingTypes
) {

    public DeploymentResult {
        createdCredentialIds = createdCredentialIds == null ? List.of() : List.copyOf(createdCredentialIds);
        oauthPendingTypes = oauthPendingTypes == null ? List.of() : List.copyOf(oauthPendingTypes);
    }

    public static DeploymentResult succeeded(String workflowId, String workflowUrl,
                                             List<String> credentialIds, List<String> oauthPendingTypes) {
        return new DeploymentResult(true, workflowId, workflowUrl, credentialIds, null, null, null, oauthPendingTypes);
    }

    public static DeploymentResult failed(String error, String errorDetail, DeploymentErrorType errorType) {
        return new DeploymentResult(false, null, null, List.of(), error, errorDetail, errorType, List.of());
    }
}
