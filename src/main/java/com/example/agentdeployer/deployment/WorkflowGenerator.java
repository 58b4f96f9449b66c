package com.example.agentdeployer.deployment;

import com.example.agentdeployer.credential.InvalidTemplateException;
import com.example.agentdeployer.n8n.N8nCredential;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an agent template into the workflow document sent to n8n: a renamed,
 * inactive copy without an id whose credential references point at the
 * credentials created for this deployment. The template itself is left untouched.
 */
@Slf4j
@Component
public class WorkflowGenerator {

    public ObjectNode generate(JsonNode template, String workflowName, CredentialBindings bindings) {
        if (template == null || !template.isObject()) {
            throw new InvalidTemplateException("Workflow template must be a JSON object");
        }
        ObjectNode workflow = (ObjectNode) template.deepCopy();
        workflow.put("name", workflowName);
        workflow.put("active", false);
        workflow.remove("id");

        int rewritten = 0;
        JsonNode nodes = workflow.path("nodes");
        if (nodes.isArray()) {
            for (JsonNode node : nodes) {
                JsonNode credentials = node.path("credentials");
                if (credentials.isObject()) {
                    rewritten += rebind((ObjectNode) credentials, bindings);
                }
            }
        }
        log.debug("Generated workflow '{}' with {} credential reference(s) rebound", workflowName, rewritten);
        return workflow;
    }

    private int rebind(ObjectNode credentials, CredentialBindings bindings) {
        int count = 0;
        Iterator<Map.Entry<String, JsonNode>> refs = credentials.fields();
        while (refs.hasNext()) {
            Map.Entry<String, JsonNode> ref = refs.next();
            String type = ref.getKey();
            String refName = ref.getValue().path("name").asText(null);

            Optional<N8nCredential> created = bindings.resolve(type, refName);
            if (created.isEmpty()) {
                continue;
            }
            ObjectNode binding = credentials.objectNode();
            binding.put("id", created.get().id());
            binding.put("name", firstNonBlank(refName, created.get().name(), type));
            ref.setValue(binding);
            count++;
        }
        return count;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
