package com.marquee.backend.exception;

/**
 * Provider rejected the credentials (HTTP 401/403). Trips the provider circuit immediately.
 */
public class AuthenticationException extends AiProviderException {

    public AuthenticationException(String provider, String message) {
        super(provider, message);
    }

    public AuthenticationException(String provider, String message, int statusCode, Throwable cause) {
        super(provider, message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorType() {
        return "AUTHENTICATION";
    }
}
