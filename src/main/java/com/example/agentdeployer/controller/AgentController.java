package com.example.agentdeployer.controller;

import com.example.agentdeployer.credential.CredentialSchema;
import com.example.agentdeployer.domain.Agent;
import com.example.agentdeployer.service.AgentService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Agent catalogue REST API.
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private final AgentService agentService;

    public record CreateAgentRequest(String name, String description, JsonNode template) {
    }

    @PostMapping
    public ResponseEntity<Agent> create(@RequestBody CreateAgentRequest request) {
        Agent agent = agentService.create(request.name(), request.description(), request.template());
        return ResponseEntity.status(HttpStatus.CREATED).body(agent);
    }

    /**
     * Preview the credentials a template needs without saving anything.
     */
    @PostMapping("/extract-credentials")
    public ResponseEntity<CredentialSchema> extractCredentials(@RequestBody JsonNode template) {
        return ResponseEntity.ok(agentService.extractCredentials(template));
    }

    @GetMapping
    public ResponseEntity<List<Agent>> list() {
        return ResponseEntity.ok(agentService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Agent> get(@PathVariable String id) {
        return ResponseEntity.ok(agentService.get(id));
    }

    @GetMapping("/{id}/credential-schema")
    public ResponseEntity<CredentialSchema> credentialSchema(@PathVariable String id) {
        return ResponseEntity.ok(agentService.credentialSchema(agentService.get(id)));
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<Agent> toggle(@PathVariable String id) {
        return ResponseEntity.ok(agentService.toggleActive(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        agentService.delete(id);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }
}
