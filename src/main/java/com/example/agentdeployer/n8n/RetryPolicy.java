package com.example.agentdeployer.n8n;

import com.example.agentdeployer.config.DeployerProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries a single remote call on rate limiting and transient failures.
 *
 * At most {@code 1 + maxRetries} attempts. The delay before retry n is
 * {@code initialDelayMs * 2^(n-1)}, capped at {@code maxDelayMs}; 429 responses wait at
 * least {@code rateLimitDelayMs} and at least the server's Retry-After hint.
 * Non-retryable failures propagate on the first attempt.
 */
@Slf4j
@Component
public class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final DeployerProperties.RetryConfig config;
    private final MeterRegistry meterRegistry;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(DeployerProperties properties, MeterRegistry meterRegistry) {
        this(properties.getRetry(), meterRegistry, Thread::sleep);
    }

    public RetryPolicy(DeployerProperties.RetryConfig config, MeterRegistry meterRegistry, Sleeper sleeper) {
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = 1 + Math.max(0, config.getMaxRetries());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (N8nApiException e) {
                if (!e.isRetryable() || attempt == maxAttempts) {
                    if (attempt > 1) {
                        log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    }
                    throw e;
                }

                long delayMs = delayBeforeRetry(e, attempt);
                log.warn("{} failed (status {}), retry {}/{} in {}ms: {}",
                        operation, e.getStatusCode(), attempt, maxAttempts - 1, delayMs, e.getMessage());
                Counter.builder("deployer.remote.retries")
                        .tag("operation", operation)
                        .register(meterRegistry)
                        .increment();

                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
        throw new IllegalStateException("Retry loop for " + operation + " exited without a result");
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    long delayBeforeRetry(N8nApiException error, int attempt) {
        int exponent = Math.min(attempt - 1, 20);
        long delay = Math.min(config.getInitialDelayMs() * (1L << exponent), config.getMaxDelayMs());

        if (error.isRateLimited()) {
            delay = Math.max(delay, config.getRateLimitDelayMs());
            if (error.getRetryAfterMs() != null) {
                delay = Math.max(delay, error.getRetryAfterMs());
            }
        }
        return delay;
    }
}
