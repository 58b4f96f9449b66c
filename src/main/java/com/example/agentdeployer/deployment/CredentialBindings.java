package com.example.agentdeployer.deployment;

import com.example.agentdeployer.n8n.N8nCredential;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credentials created during one attempt, looked up by the type (and, for
 * name-disambiguated types, the name) a template node refers to.
 * Not thread-safe; owned by a single attempt.
 */
public class CredentialBindings {

    private final Map<String, N8nCredential> byType = new HashMap<>();
    private final Map<String, N8nCredential> byTypeAndName = new HashMap<>();

    public void bind(N8nCredential created) {
        byType.put(created.type(), created);
        if (created.name() != null) {
            byTypeAndName.put(key(created.type(), created.name()), created);
        }
    }

    /** An exact type+name match wins; otherwise the last credential created for the type. */
    public Optional<N8nCredential> resolve(String type, String refName) {
        if (refName != null && !refName.isEmpty()) {
            N8nCredential exact = byTypeAndName.get(key(type, refName));
            if (exact != null) {
                return Optional.of(exact);
            }
        }
        return Optional.ofNullable(byType.get(type));
    }

    private static String key(String type, String name) {
        return type + ":" + name;
    }
}
