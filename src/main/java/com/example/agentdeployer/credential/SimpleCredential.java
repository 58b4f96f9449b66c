package com.example.agentdeployer.credential;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A required secret identified by its n8n credential type alone.
 *
 * @param instances number of template node references to this type
 * @param inferred  true when the field list was guessed from the type name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimpleCredential(
        String type,
        String displayName,
        int instances,
        List<CredentialField> fields,
        boolean oauth,
        String note,
        boolean inferred
) {
}
