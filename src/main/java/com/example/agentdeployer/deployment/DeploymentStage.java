package com.example.agentdeployer.deployment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stages of one deployment attempt. The forward path runs top to bottom up to
 * {@link #COMPLETED}; any stage may divert to {@link #ROLLING_BACK} and then {@link #FAILED}.
 */
public enum DeploymentStage {
    INITIALIZING,
    CREATING_CREDENTIALS,
    GENERATING_WORKFLOW,
    DEPLOYING,
    ACTIVATING,
    COMPLETED,
    ROLLING_BACK,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
