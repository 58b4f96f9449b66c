package com.example.agentdeployer.controller;

import com.example.agentdeployer.domain.Client;
import com.example.agentdeployer.domain.DeploymentType;
import com.example.agentdeployer.repository.ClientRepository;
import com.example.agentdeployer.service.ActivityLogService;
import com.example.agentdeployer.service.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Client REST API.
 */
@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientRepository clientRepository;
    private final ActivityLogService activityLog;

    @PostMapping
    public ResponseEntity<Client> create(@RequestBody Client client) {
        if (client.getName() == null || client.getName().isBlank()) {
            throw new IllegalArgumentException("Client name is required");
        }
        if (client.getEmail() == null || client.getEmail().isBlank()) {
            throw new IllegalArgumentException("Client email is required");
        }
        if (client.getDeploymentType() == null) {
            client.setDeploymentType(DeploymentType.CLIENT_INSTANCE);
        }
        client.setId(null);
        client.setStatus(Client.ClientStatus.ACTIVE);
        Client saved = clientRepository.save(client);
        activityLog.record(ActivityLogService.CLIENT, saved.getId(), "created", "Created client " + saved.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @GetMapping
    public ResponseEntity<List<Client>> list() {
        return ResponseEntity.ok(clientRepository.findAllByOrderByCreatedAtDesc());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Client> get(@PathVariable String id) {
        return ResponseEntity.ok(clientRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Client", id)));
    }
}
