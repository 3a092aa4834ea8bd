package com.marquee.backend.exception;

/**
 * Provider rejected the request for rate limiting (HTTP 429).
 */
public class RateLimitException extends AiProviderException {

    public RateLimitException(String provider, String message) {
        super(provider, message);
    }

    public RateLimitException(String provider, String message, int statusCode, Throwable cause) {
        super(provider, message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorType() {
        return "RATE_LIMIT";
    }
}
