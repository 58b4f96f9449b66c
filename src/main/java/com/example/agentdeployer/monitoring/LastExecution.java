package com.example.agentdeployer.monitoring;

import com.example.agentdeployer.n8n.N8nExecution;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastExecution(String id, String status, Instant startedAt, Instant finishedAt) {

    public static LastExecution from(N8nExecution execution) {
        return new LastExecution(execution.id(), execution.status(), execution.startedAt(), execution.stoppedAt());
    }

    public boolean isError() {
        return "error".equals(status) || "crashed".equals(status) || "failed".equals(status);
    }
}
