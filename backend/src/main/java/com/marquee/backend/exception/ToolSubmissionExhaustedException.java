package com.marquee.backend.exception;

public class ToolSubmissionExhaustedException extends RuntimeException {
    private final int attempts;

    public ToolSubmissionExhaustedException(int attempts, String lastError) {
        super("Tool submission exhausted after " + attempts + " attempts"
                + (lastError != null ? ": " + lastError : ""));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
