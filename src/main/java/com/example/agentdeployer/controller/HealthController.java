package com.example.agentdeployer.controller;

import com.example.agentdeployer.domain.DeploymentAlert;
import com.example.agentdeployer.service.HealthCheckService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Fleet health summary and alert handling.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final HealthCheckService healthCheckService;

    @GetMapping("/health/summary")
    public ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(healthCheckService.summary());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<DeploymentAlert>> openAlerts() {
        return ResponseEntity.ok(healthCheckService.getOpenAlerts());
    }

    @PostMapping("/alerts/{id}/acknowledge")
    public ResponseEntity<DeploymentAlert> acknowledge(@PathVariable String id) {
        return ResponseEntity.ok(healthCheckService.acknowledge(id));
    }
}
