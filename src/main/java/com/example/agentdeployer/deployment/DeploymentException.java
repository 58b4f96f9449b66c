package com.example.agentdeployer.deployment;

import lombok.Getter;

/**
 * A stage failure inside {@link DeploymentEngine}. Never escapes the engine;
 * it is turned into a failed {@link DeploymentResult} after rollback.
 */
@Getter
public class DeploymentException extends RuntimeException {

    private final DeploymentErrorType errorType;

    public DeploymentException(DeploymentErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DeploymentException(DeploymentErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
