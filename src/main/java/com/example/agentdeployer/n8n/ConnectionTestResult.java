package com.example.agentdeployer.n8n;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of {@link RemoteAutomationClient#testConnection()}.
 * {@code failure} keeps the classified error so callers can decide whether to retry.
 */
public record ConnectionTestResult(
        boolean success,
        String message,
        int statusCode,
        @JsonIgnore N8nApiException failure
) {

    public static ConnectionTestResult ok(int statusCode) {
        return new ConnectionTestResult(true, "Connection successful", statusCode, null);
    }

    public static ConnectionTestResult failed(String message, N8nApiException failure) {
        return new ConnectionTestResult(false, message, failure.getStatusCode(), failure);
    }
}
