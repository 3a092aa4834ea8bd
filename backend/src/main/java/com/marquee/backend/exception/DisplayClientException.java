package com.marquee.backend.exception;

public class DisplayClientException extends RuntimeException {
    private final int statusCode;

    public DisplayClientException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public DisplayClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public DisplayClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
