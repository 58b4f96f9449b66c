package com.example.agentdeployer.deployment;

/**
 * Receives progress events synchronously on the deploying thread.
 * Implementations must return quickly; a slow listener stalls the pipeline.
 */
@FunctionalInterface
public interface DeploymentProgressListener {

    DeploymentProgressListener NONE = progress -> { };

    void onProgress(DeploymentProgress progress);

    default DeploymentProgressListener andThen(DeploymentProgressListener next) {
        return progress -> {
            onProgress(progress);
            next.onProgress(progress);
        };
    }
}
