package com.marquee.backend.model;

/**
 * Stored position of a circuit. {@code OFF} blocks traffic; {@code HALF_OPEN} lets probe calls through.
 */
public enum CircuitState {
    ON,
    OFF,
    HALF_OPEN
}
