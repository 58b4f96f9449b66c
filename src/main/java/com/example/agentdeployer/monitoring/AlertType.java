package com.example.agentdeployer.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    WORKFLOW_INACTIVE,
    EXECUTION_FAILED,
    CONNECTION_LOST,
    HIGH_FAILURE_RATE,
    SLOW_EXECUTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
