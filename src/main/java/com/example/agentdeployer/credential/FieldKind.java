package com.example.agentdeployer.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How an operator-facing credential field is rendered and stored. */
public enum FieldKind {
    @JsonProperty("text")
    TEXT,
    @JsonProperty("secret")
    SECRET
}
