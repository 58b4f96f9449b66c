package com.example.agentdeployer.credential;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A required secret of a generic auth type, told apart from others of the same
 * type by the name the template author gave it.
 *
 * @param keyword the name with stop words removed, used to match an operator's secret
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpecialCredential(
        String type,
        String displayName,
        String keyword,
        int instances,
        List<CredentialField> fields,
        boolean oauth,
        String note,
        boolean inferred
) {
}
