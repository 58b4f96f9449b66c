package com.example.agentdeployer.deployment;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Progress event of a deployment attempt. Observational only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentProgress(DeploymentStage stage, int percent, String message, String detail) {

    public static DeploymentProgress of(DeploymentStage stage, int percent, String message) {
        return new DeploymentProgress(stage, percent, message, null);
    }
}
