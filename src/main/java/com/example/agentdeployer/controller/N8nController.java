package com.example.agentdeployer.controller;

import com.example.agentdeployer.config.DeployerProperties;
import com.example.agentdeployer.n8n.ConnectionTestResult;
import com.example.agentdeployer.n8n.N8nClientFactory;
import com.example.agentdeployer.n8n.WorkflowSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Direct n8n helpers used before a deployment exists.
 */
@RestController
@RequestMapping("/api/n8n")
@RequiredArgsConstructor
public class N8nController {

    static final int WORKFLOW_LIST_LIMIT = 250;

    private final N8nClientFactory clientFactory;
    private final DeployerProperties properties;

    public record TestConnectionRequest(String url, String apiKey) {
    }

    @PostMapping("/test-connection")
    public ResponseEntity<ConnectionTestResult> testConnection(@RequestBody TestConnectionRequest request) {
        return ResponseEntity.ok(clientFactory.forInstance(request.url(), request.apiKey()).testConnection());
    }

    /**
     * Workflows on the managed instance.
     */
    @GetMapping("/workflows")
    public ResponseEntity<List<WorkflowSummary>> workflows() {
        DeployerProperties.ManagedInstanceConfig managed = properties.getManagedInstance();
        if (!managed.isConfigured()) {
            throw new IllegalStateException("Managed n8n instance is not configured");
        }
        return ResponseEntity.ok(clientFactory.forInstance(managed.getUrl(), managed.getApiKey())
                .listWorkflows(WORKFLOW_LIST_LIMIT));
    }
}
