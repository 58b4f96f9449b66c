package com.example.agentdeployer.n8n;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * n8n public REST API client (v1) over OkHttp.
 *
 * One instance per n8n base URL and API key; obtain it from {@link N8nClientFactory}.
 */
@Slf4j
public class N8nClient implements RemoteAutomationClient {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String API_KEY_HEADER = "X-N8N-API-KEY";
    private static final String API_PREFIX = "/api/v1";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public N8nClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.apiKey = apiKey;
    }

    public static String normalizeBaseUrl(String url) {
        if (url == null) {
            throw new IllegalArgumentException("n8n URL is required");
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    // ── Connection ──

    @Override
    public ConnectionTestResult testConnection() {
        Request request = authorized(api("/workflows").newBuilder()
                .addQueryParameter("limit", "1").build())
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return ConnectionTestResult.ok(response.code());
            }
            String message = switch (response.code()) {
                case 401 -> "Invalid API key";
                case 403 -> "Access denied - check API key permissions";
                default -> String.format("Connection failed: %d %s", response.code(), response.message()).trim();
            };
            return ConnectionTestResult.failed(message,
                    new N8nApiException(response.code(), message, retryAfterMs(response)));
        } catch (IOException e) {
            String message = e instanceof ConnectException
                    ? "Unable to connect - check if n8n is running"
                    : "Connection error: " + e.getMessage();
            return ConnectionTestResult.failed(message, new N8nApiException(message, e));
        }
    }

    // ── Credentials ──

    @Override
    public N8nCredential createCredential(N8nCredential credential) {
        JsonNode created = send(authorized(api("/credentials"))
                .post(jsonBody(credential))
                .build());
        return convert(created, N8nCredential.class);
    }

    @Override
    public void deleteCredential(String id) {
        send(authorized(api("/credentials/" + id)).delete().build());
    }

    // ── Workflows ──

    @Override
    public JsonNode createWorkflow(JsonNode workflow) {
        return send(authorized(api("/workflows")).post(jsonBody(workflow)).build());
    }

    @Override
    public JsonNode getWorkflow(String id) {
        return send(authorized(api("/workflows/" + id)).get().build());
    }

    @Override
    public List<WorkflowSummary> listWorkflows(int limit) {
        HttpUrl url = api("/workflows").newBuilder()
                .addQueryParameter("limit", String.valueOf(limit))
                .build();
        JsonNode page = send(authorized(url).get().build());

        List<WorkflowSummary> workflows = new ArrayList<>();
        for (JsonNode wf : dataArray(page)) {
            workflows.add(new WorkflowSummary(
                    wf.path("id").asText(null),
                    wf.path("name").asText(null),
                    wf.path("active").asBoolean(false),
                    wf.path("createdAt").asText(null),
                    wf.path("updatedAt").asText(null)));
        }
        return workflows;
    }

    @Override
    public void deleteWorkflow(String id) {
        send(authorized(api("/workflows/" + id)).delete().build());
    }

    @Override
    public JsonNode activateWorkflow(String id) {
        return send(authorized(api("/workflows/" + id + "/activate"))
                .post(RequestBody.create(new byte[0], JSON))
                .build());
    }

    // ── Executions ──

    @Override
    public List<N8nExecution> getExecutions(String workflowId, int limit) {
        HttpUrl url = api("/executions").newBuilder()
                .addQueryParameter("limit", String.valueOf(limit))
                .addQueryParameter("workflowId", workflowId)
                .build();
        JsonNode page = send(authorized(url).get().build());

        List<N8nExecution> executions = new ArrayList<>();
        for (JsonNode execution : dataArray(page)) {
            executions.add(convert(execution, N8nExecution.class));
        }
        return executions;
    }

    // ── Health ──

    @Override
    public InstanceHealth healthCheck() {
        Request request = new Request.Builder()
                .url(HttpUrl.get(baseUrl + "/healthz"))
                .get()
                .build();

        long start = System.currentTimeMillis();
        try (Response response = httpClient.newCall(request).execute()) {
            long latency = System.currentTimeMillis() - start;
            if (response.isSuccessful()) {
                return InstanceHealth.up(latency);
            }
            return InstanceHealth.down(latency, "Status: " + response.code());
        } catch (IOException e) {
            log.debug("Health probe against {} failed: {}", baseUrl, e.getMessage());
            return InstanceHealth.down(null, e.getMessage());
        }
    }

    // ── Plumbing ──

    private HttpUrl api(String path) {
        return HttpUrl.get(baseUrl + API_PREFIX + path);
    }

    private Request.Builder authorized(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header(API_KEY_HEADER, apiKey)
                .header("Accept", "application/json");
    }

    private RequestBody jsonBody(Object payload) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request payload: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode send(Request request) {
        String body;
        int status;
        try (Response response = httpClient.newCall(request).execute()) {
            status = response.code();
            body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw errorFrom(response, body);
            }
        } catch (IOException e) {
            throw new N8nApiException(String.format("%s %s failed: %s",
                    request.method(), request.url().encodedPath(), e.getMessage()), e);
        }

        if (body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new N8nApiException(status, "Malformed response from n8n: " + e.getOriginalMessage());
        }
    }

    private N8nApiException errorFrom(Response response, String body) {
        String message = String.format("n8n API Error: %d %s", response.code(), response.message()).trim();
        if (!body.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(body);
                if (error.hasNonNull("message")) {
                    message = error.get("message").asText();
                }
            } catch (JsonProcessingException notJson) {
                log.debug("Non-JSON error body from {}: {}", baseUrl, notJson.getOriginalMessage());
            }
        }
        return new N8nApiException(response.code(), message, retryAfterMs(response));
    }

    /** Retry-After as delta-seconds or HTTP-date. */
    static Long retryAfterMs(Response response) {
        String header = response.header("Retry-After");
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(header.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
                return Math.max(0L, Duration.between(ZonedDateTime.now(at.getZone()), at).toMillis());
            } catch (DateTimeParseException unparseable) {
                return null;
            }
        }
    }

    private Iterable<JsonNode> dataArray(JsonNode page) {
        JsonNode data = page.has("data") ? page.get("data") : page;
        return data.isArray() ? data : List.of();
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.readerFor(type)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(node);
        } catch (IOException e) {
            throw new N8nApiException(200, "Unexpected " + type.getSimpleName() + " payload: " + e.getMessage());
        }
    }
}
