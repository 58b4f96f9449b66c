package com.example.agentdeployer.service;

import com.example.agentdeployer.credential.CredentialSchema;
import com.example.agentdeployer.credential.CredentialSchemaExtractor;
import com.example.agentdeployer.domain.Agent;
import com.example.agentdeployer.repository.AgentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Agent catalogue. The credential schema is extracted once, when the agent is created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentService {

    private final AgentRepository agentRepository;
    private final CredentialSchemaExtractor credentialExtractor;
    private final ActivityLogService activityLog;
    private final ObjectMapper objectMapper;

    @Transactional
    public Agent create(String name, String description, JsonNode template) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name is required");
        }
        if (agentRepository.existsByNameIgnoreCaseAndDeletedAtIsNull(name.trim())) {
            throw new IllegalStateException("An agent named '" + name.trim() + "' already exists");
        }
        CredentialSchema schema = credentialExtractor.extract(template);

        Agent agent = agentRepository.save(Agent.builder()
                .name(name.trim())
                .description(description)
                .templateJson(write(template))
                .credentialSchemaJson(write(schema))
                .active(true)
                .build());

        log.info("Created agent {} ({}) requiring {} simple and {} special credentials",
                agent.getName(), agent.getId(), schema.simple().size(), schema.special().size());
        activityLog.record(ActivityLogService.AGENT, agent.getId(), "created",
                "Created agent " + agent.getName(),
                Map.of("simpleCredentials", schema.simple().size(), "specialCredentials", schema.special().size()));
        return agent;
    }

    public CredentialSchema extractCredentials(JsonNode template) {
        return credentialExtractor.extract(template);
    }

    public List<Agent> list() {
        return agentRepository.findByDeletedAtIsNullOrderByCreatedAtDesc();
    }

    public Agent get(String id) {
        return agentRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new ResourceNotFoundException("Agent", id));
    }

    public JsonNode template(Agent agent) {
        return read(agent.getTemplateJson());
    }

    public CredentialSchema credentialSchema(Agent agent) {
        if (agent.getCredentialSchemaJson() == null) {
            return CredentialSchema.empty();
        }
        try {
            return objectMapper.readValue(agent.getCredentialSchemaJson(), CredentialSchema.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored credential schema of agent " + agent.getId() + " is corrupt", e);
        }
    }

    @Transactional
    public Agent toggleActive(String id) {
        Agent agent = get(id);
        agent.setActive(!agent.isActive());
        Agent saved = agentRepository.save(agent);
        activityLog.record(ActivityLogService.AGENT, id, saved.isActive() ? "activated" : "deactivated",
                (saved.isActive() ? "Activated agent " : "Deactivated agent ") + saved.getName());
        return saved;
    }

    @Transactional
    public void delete(String id) {
        Agent agent = get(id);
        agent.setDeletedAt(Instant.now());
        agentRepository.save(agent);
        activityLog.record(ActivityLogService.AGENT, id, "deleted", "Deleted agent " + agent.getName());
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored workflow template is not valid JSON", e);
        }
    }
}
