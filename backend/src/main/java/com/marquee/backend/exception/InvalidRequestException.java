package com.marquee.backend.exception;

public class InvalidRequestException extends AiProviderException {

    public InvalidRequestException(String provider, String message) {
        super(provider, message);
    }

    public InvalidRequestException(String provider, String message, int statusCode, Throwable cause) {
        super(provider, message, statusCode, cause);
    }

    @Override
    public String getErrorType() {
        return "INVALID_REQUEST";
    }
}
