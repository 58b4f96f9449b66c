package com.example.agentdeployer.n8n;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Credential as sent to and returned by n8n. The backend never echoes {@code data} back.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record N8nCredential(String id, String name, String type, Map<String, Object> data) {

    public static N8nCredential of(String name, String type, Map<String, Object> data) {
        return new N8nCredential(null, name, type, data);
    }
}
