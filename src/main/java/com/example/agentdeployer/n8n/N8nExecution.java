package com.example.agentdeployer.n8n;

import java.time.Duration;
import java.time.Instant;

/**
 * One workflow execution record. {@code status} is one of n8n's execution states
 * (success, error, crashed, running, waiting, ...).
 */
public record N8nExecution(
        String id,
        boolean finished,
        String mode,
        Instant startedAt,
        Instant stoppedAt,
        String workflowId,
        String status
) {

    public boolean isSuccess() {
        return "success".equals(status);
    }

    public boolean isError() {
        return "error".equals(status) || "crashed".equals(status) || "failed".equals(status);
    }

    public boolean isTimed() {
        return startedAt != null && stoppedAt != null;
    }

    /** Duration in millis; only meaningful when {@link #isTimed()}. May be negative under clock skew. */
    public long durationMs() {
        if (!isTimed()) {
            throw new IllegalStateException("Execution " + id + " has no start or stop time");
        }
        return Duration.between(startedAt, stoppedAt).toMillis();
    }
}
