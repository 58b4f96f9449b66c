package com.example.agentdeployer.n8n;

import com.example.agentdeployer.config.DeployerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private RetryPolicy retryPolicy;

    @BeforeEach
    void setUp() {
        DeployerProperties.RetryConfig config = new DeployerProperties.RetryConfig();
        config.setMaxRetries(3);
        config.setInitialDelayMs(100);
        config.setRateLimitDelayMs(5000);
        config.setMaxDelayMs(1000);
        meterRegistry = new SimpleMeterRegistry();
        retryPolicy = new RetryPolicy(config, meterRegistry, sleeps::add);
    }

    @Test
    void transientFailureIsAttemptedOncePlusMaxRetries() {
        AtomicInteger calls = new AtomicInteger();

        N8nApiException error = assertThrows(N8nApiException.class, () -> retryPolicy.execute("createWorkflow", () -> {
            calls.incrementAndGet();
            throw new N8nApiException(503, "Service Unavailable");
        }));

        assertEquals(503, error.getStatusCode());
        assertEquals(4, calls.get());
        assertEquals(List.of(100L, 200L, 400L), sleeps);
        assertEquals(3.0, meterRegistry.counter("deployer.remote.retries", "operation", "createWorkflow").count());
    }

    @Test
    void authFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(N8nApiException.class, () -> retryPolicy.execute("createCredential", () -> {
            calls.incrementAndGet();
            throw new N8nApiException(401, "Invalid API key");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(N8nApiException.class, () -> retryPolicy.execute("createWorkflow", () -> {
            calls.incrementAndGet();
            throw new N8nApiException(400, "request/body must have required property 'connections'");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void rateLimitWaitsForRetryAfterThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String result = retryPolicy.execute("activateWorkflow", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new N8nApiException(429, "Too Many Requests", 7000L);
            }
            return "activated";
        });

        assertEquals("activated", result);
        assertEquals(2, calls.get());
        assertEquals(List.of(7000L), sleeps);
    }

    @Test
    void rateLimitWaitsAtLeastTheConfiguredDelay() {
        long delay = retryPolicy.delayBeforeRetry(new N8nApiException(429, "Too Many Requests", 200L), 1);

        assertEquals(5000L, delay);
    }

    @Test
    void backoffIsCapped() {
        assertEquals(1000L, retryPolicy.delayBeforeRetry(new N8nApiException(502, "Bad Gateway"), 10));
    }

    @Test
    void refusedConnectionIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        Integer value = retryPolicy.execute("testConnection", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new N8nApiException("GET /api/v1/workflows failed",
                        new IOException("wrapped", new ConnectException("Connection refused")));
            }
            return 200;
        });

        assertEquals(200, value);
        assertEquals(3, calls.get());
    }

    @Test
    void runWrapsVoidCalls() {
        List<String> deleted = new ArrayList<>();

        retryPolicy.run("deleteCredential", () -> deleted.add("cred-1"));

        assertEquals(List.of("cred-1"), deleted);
    }
}
