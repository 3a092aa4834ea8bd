package com.marquee.backend.dto;

import com.marquee.backend.model.CircuitState;
import jakarta.validation.constraints.NotNull;

public record CircuitStateUpdateRequest(@NotNull CircuitState state) {}
