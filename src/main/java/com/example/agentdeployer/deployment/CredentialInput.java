package com.example.agentdeployer.deployment;

import java.util.Map;

/**
 * One credential to create on the target instance.
 *
 * @param type n8n credential type, e.g. {@code openAiApi}
 * @param name display name of the credential in n8n
 * @param data type-specific secret payload
 */
public record CredentialInput(String type, String name, Map<String, Object> data) {

    public CredentialInput {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    @Override
    public String toString() {
        return "CredentialInput[type=" + type + ", name=" + name + ", data=<" + data.size() + " fields>]";
    }
}
