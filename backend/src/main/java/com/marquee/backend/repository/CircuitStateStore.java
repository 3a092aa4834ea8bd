package com.marquee.backend.repository;

import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for circuit rows. Implementations may throw on storage failure; callers decide how to degrade.
 */
public interface CircuitStateStore {

    Optional<CircuitBreakerState> find(String circuitId);

    List<CircuitBreakerState> findAll();

    List<CircuitBreakerState> findByType(CircuitType type);

    /**
     * Inserts the row if no row with the same circuit id exists. Returns true when a row was created.
     */
    boolean createIfAbsent(CircuitBreakerState state);

    void updateState(String circuitId, CircuitState state, Instant now);

    void incrementFailureCount(String circuitId, Instant now);

    void incrementSuccessCount(String circuitId, Instant now);

    void resetCounters(String circuitId, Instant now);
}
