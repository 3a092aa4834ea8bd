package com.marquee.backend.service.content;

/**
 * What the tool negotiation loop does when every attempt was rejected.
 */
public enum ExhaustionStrategy {
    /** Raise {@link com.marquee.backend.exception.ToolSubmissionExhaustedException}. */
    THROW,
    /** Force-accept the last submission truncated to the content area. */
    USE_LAST
}
