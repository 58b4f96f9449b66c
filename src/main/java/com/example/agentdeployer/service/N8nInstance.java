package com.example.agentdeployer.service;

/** Address and API key of the n8n instance a deployment lives on. */
public record N8nInstance(String url, String apiKey) {

    @Override
    public String toString() {
        return "N8nInstance[url=" + url + "]";
    }
}
