package com.example.agentdeployer.credential;

import java.util.List;

/**
 * Registry entry: the exact field list n8n expects for a credential type, and
 * whether the type needs an interactive OAuth consent step.
 */
public record CredentialTypeDefinition(String type, boolean oauth, String note, List<CredentialField> fields) {

    public CredentialTypeDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
