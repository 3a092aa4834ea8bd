package com.marquee.backend.exception;

/**
 * Base failure of an AI provider call. Subclasses classify the failure for failover and circuit decisions.
 */
public class AiProviderException extends RuntimeException {
    private final String provider;
    private final int statusCode;

    public AiProviderException(String provider, String message) {
        this(provider, message, -1, null);
    }

    public AiProviderException(String provider, String message, Throwable cause) {
        this(provider, message, -1, cause);
    }

    public AiProviderException(String provider, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Whether a single retry against the alternate provider is worthwhile.
     */
    public boolean isRetryable() {
        return false;
    }

    public String getErrorType() {
        return "PROVIDER_ERROR";
    }
}
