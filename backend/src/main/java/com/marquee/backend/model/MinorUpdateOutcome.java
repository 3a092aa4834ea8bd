package com.marquee.backend.model;

public enum MinorUpdateOutcome {
    SENT,
    SKIPPED_NO_CACHE,
    SKIPPED_FULL_LAYOUT,
    SKIPPED_BLOCKED,
    FAILED
}
