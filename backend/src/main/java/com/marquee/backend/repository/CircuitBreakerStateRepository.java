package com.marquee.backend.repository;

import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CircuitBreakerStateRepository extends JpaRepository<CircuitBreakerState, Long> {
    Optional<CircuitBreakerState> findByCircuitId(String circuitId);

    List<CircuitBreakerState> findByCircuitTypeOrderByCircuitIdAsc(CircuitType circuitType);

    List<CircuitBreakerState> findAllByOrderByCircuitIdAsc();

    boolean existsByCircuitId(String circuitId);

    // Counters are bumped in the database so concurrent failures are never lost
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CircuitBreakerState c
               set c.failureCount = c.failureCount + 1, c.lastFailureAt = :now, c.updatedAt = :now
             where c.circuitId = :circuitId
            """)
    int incrementFailureCount(@Param("circuitId") String circuitId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CircuitBreakerState c
               set c.successCount = c.successCount + 1, c.lastSuccessAt = :now, c.updatedAt = :now
             where c.circuitId = :circuitId
            """)
    int incrementSuccessCount(@Param("circuitId") String circuitId, @Param("now") Instant now);
}
