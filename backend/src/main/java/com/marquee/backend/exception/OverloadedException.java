package com.marquee.backend.exception;

/**
 * Provider is temporarily overloaded (HTTP 503/529).
 */
public class OverloadedException extends AiProviderException {

    public OverloadedException(String provider, String message) {
        super(provider, message);
    }

    public OverloadedException(String provider, String message, int statusCode, Throwable cause) {
        super(provider, message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorType() {
        return "OVERLOADED";
    }
}
