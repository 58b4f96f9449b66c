package com.example.agentdeployer.credential;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record CredentialSchema(List<SimpleCredential> simple, List<SpecialCredential> special) {

    public CredentialSchema {
        simple = simple == null ? List.of() : List.copyOf(simple);
        special = special == null ? List.of() : List.copyOf(special);
    }

    public static CredentialSchema empty() {
        return new CredentialSchema(List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return simple.isEmpty() && special.isEmpty();
    }

    @JsonIgnore
    public boolean hasOAuth() {
        return simple.stream().anyMatch(SimpleCredential::oauth)
                || special.stream().anyMatch(SpecialCredential::oauth);
    }
}
