package com.marquee.backend.service.circuit;

import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;

public record CircuitDefinition(
        String circuitId,
        CircuitType type,
        CircuitState defaultState,
        String description,
        int failureThreshold
) {}
