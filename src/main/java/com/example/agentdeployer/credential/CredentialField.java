package com.example.agentdeployer.credential;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One input the operator must (or may) supply for a credential.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialField(
        String name,
        String label,
        FieldKind kind,
        boolean required,
        @JsonProperty("default") String defaultValue
) {

    public static CredentialField secret(String name, String label) {
        return new CredentialField(name, label, FieldKind.SECRET, true, null);
    }

    public static CredentialField text(String name, String label) {
        return new CredentialField(name, label, FieldKind.TEXT, true, null);
    }
}
