package com.example.agentdeployer.n8n;

public record InstanceHealth(boolean healthy, Long latencyMs, String error) {

    public static InstanceHealth up(long latencyMs) {
        return new InstanceHealth(true, latencyMs, null);
    }

    public static InstanceHealth down(Long latencyMs, String error) {
        return new InstanceHealth(false, latencyMs, error);
    }
}
