package com.example.agentdeployer.domain;

/**
 * Where a client's workflows run: on the client's own n8n instance, or on the
 * operator's managed instance.
 */
public enum DeploymentType {
    CLIENT_INSTANCE,
    YOUR_INSTANCE
}
