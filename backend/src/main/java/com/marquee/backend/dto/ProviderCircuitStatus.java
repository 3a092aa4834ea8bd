package com.marquee.backend.dto;

import com.marquee.backend.model.CircuitState;
import lombok.Builder;

import java.time.Instant;

@Builder
public record ProviderCircuitStatus(
        String circuitId,
        CircuitState state,
        int failureCount,
        int successCount,
        int failureThreshold,
        Instant lastFailureAt,
        Instant lastSuccessAt,
        Instant stateChangedAt,
        boolean canAttempt,
        long resetTimeoutMs
) {}
