package com.example.agentdeployer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true);
        return mapper;
    }

    /**
     * Shared HTTP client. Per-instance n8n clients derive from it so they share
     * the connection pool and dispatcher.
     */
    @Bean
    public OkHttpClient okHttpClient(DeployerProperties properties) {
        DeployerProperties.N8nConfig n8n = properties.getN8n();
        return new OkHttpClient.Builder()
                .connectTimeout(n8n.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(n8n.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(n8n.getWriteTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }
}
