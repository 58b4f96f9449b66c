package com.example.agentdeployer.n8n;

import com.example.agentdeployer.config.DeployerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Hands out {@link RemoteAutomationClient}s per n8n instance. Clients are cached
 * by base URL and API key so repeated health sweeps reuse them.
 */
@Slf4j
@Component
public class N8nClientFactory {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Cache<String, RemoteAutomationClient> clients;

    public N8nClientFactory(OkHttpClient httpClient, ObjectMapper objectMapper, DeployerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clients = Caffeine.newBuilder()
                .maximumSize(properties.getN8n().getClientCacheSize())
                .expireAfterAccess(properties.getN8n().getClientCacheTtlMinutes(), TimeUnit.MINUTES)
                .build();
    }

    public RemoteAutomationClient forInstance(String baseUrl, String apiKey) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("n8n URL is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("n8n API key is required");
        }
        String normalized = N8nClient.normalizeBaseUrl(baseUrl);
        return clients.get(normalized + '\n' + apiKey, key -> {
            log.debug("Creating n8n client for {}", normalized);
            return new N8nClient(httpClient, objectMapper, normalized, apiKey);
        });
    }
}
