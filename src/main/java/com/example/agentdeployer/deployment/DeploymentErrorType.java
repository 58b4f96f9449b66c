package com.example.agentdeployer.deployment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeploymentErrorType {
    CONNECTION_FAILED,
    CREDENTIAL_CREATION_FAILED,
    WORKFLOW_CREATION_FAILED,
    WORKFLOW_ACTIVATION_FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
