package com.example.agentdeployer.controller;

import com.example.agentdeployer.deployment.DeploymentProgress;
import com.example.agentdeployer.domain.Deployment;
import com.example.agentdeployer.domain.DeploymentAlert;
import com.example.agentdeployer.domain.HealthCheckRecord;
import com.example.agentdeployer.monitoring.HealthCheckResult;
import com.example.agentdeployer.service.DeploymentRequest;
import com.example.agentdeployer.service.DeploymentService;
import com.example.agentdeployer.service.HealthCheckService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Deployment REST API: start, inspect, pause/resume and health.
 */
@RestController
@RequestMapping("/api/deployments")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentService deploymentService;
    private final HealthCheckService healthCheckService;

    /**
     * Record a deployment and start it in the background. Poll {@code /progress}
     * or subscribe to {@code /ws/events} for its outcome.
     */
    @PostMapping
    public ResponseEntity<Deployment> start(@RequestBody DeploymentRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(deploymentService.start(request));
    }

    @GetMapping
    public ResponseEntity<List<Deployment>> list(@RequestParam(required = false) String clientId) {
        return ResponseEntity.ok(clientId != null
                ? deploymentService.listByClient(clientId)
                : deploymentService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Deployment> get(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.get(id));
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<List<DeploymentProgress>> progress(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.drainProgress(id));
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<Deployment> toggle(@PathVariable String id) {
        return ResponseEntity.ok(deploymentService.toggleActive(id));
    }

    @PostMapping("/{id}/health-check")
    public ResponseEntity<HealthCheckResult> checkHealth(@PathVariable String id) {
        return ResponseEntity.ok(healthCheckService.checkNow(id));
    }

    @GetMapping("/{id}/health")
    public ResponseEntity<List<HealthCheckRecord>> healthHistory(@PathVariable String id,
                                                                 @RequestParam(required = false) Integer limit) {
        deploymentService.get(id);
        return ResponseEntity.ok(healthCheckService.getHistory(id, limit));
    }

    @GetMapping("/{id}/alerts")
    public ResponseEntity<List<DeploymentAlert>> alerts(@PathVariable String id) {
        return ResponseEntity.ok(healthCheckService.getAlerts(id));
    }
}
