package com.example.agentdeployer.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
