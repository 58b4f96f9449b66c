package com.example.agentdeployer.n8n;

import lombok.Getter;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Failure of a call against the n8n REST API.
 *
 * Carries the HTTP status ({@link #TRANSPORT_FAILURE} when no response was received),
 * the backend's error message and, for 429 responses, the Retry-After hint.
 */
@Getter
public class N8nApiException extends RuntimeException {

    public static final int TRANSPORT_FAILURE = -1;

    private final int statusCode;
    private final Long retryAfterMs;

    public N8nApiException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public N8nApiException(int statusCode, String message, Long retryAfterMs) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public N8nApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = TRANSPORT_FAILURE;
        this.retryAfterMs = null;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }

    /**
     * 502/503/504 responses, or a transport failure caused by a reset connection,
     * a timeout, a refused connection or an unreachable network.
     */
    public boolean isTransient() {
        if (statusCode == 502 || statusCode == 503 || statusCode == 504) {
            return true;
        }
        return statusCode == TRANSPORT_FAILURE && isTransientNetworkFailure(getCause());
    }

    public boolean isRetryable() {
        return isRateLimited() || isTransient();
    }

    static boolean isTransientNetworkFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof ConnectException
                    || t instanceof NoRouteToHostException) {
                return true;
            }
            String message = t.getMessage() != null ? t.getMessage().toLowerCase(Locale.ROOT) : "";
            if (t instanceof InterruptedIOException && message.contains("timeout")) {
                return true;
            }
            if (t instanceof SocketException
                    && (message.contains("reset") || message.contains("unreachable"))) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
