package com.marquee.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "circuit_breaker_state")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "circuit_id", nullable = false, unique = true, length = 50)
    private String circuitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "circuit_type", nullable = false, length = 20)
    private CircuitType circuitType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CircuitState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_state", nullable = false, length = 20)
    private CircuitState defaultState;

    private String description;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_threshold", nullable = false)
    private int failureThreshold;

    private Instant lastFailureAt;

    private Instant lastSuccessAt;

    private Instant stateChangedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public CircuitBreakerState copy() {
        return toBuilder().build();
    }
}
