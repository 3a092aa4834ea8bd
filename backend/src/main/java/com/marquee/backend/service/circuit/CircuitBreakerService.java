package com.marquee.backend.service.circuit;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.dto.ProviderCircuitStatus;
import com.marquee.backend.exception.AuthenticationException;
import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;
import com.marquee.backend.repository.CircuitStateStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted on/off/half-open gate for providers plus the manual kill switches.
 * <p>
 * Every storage failure is logged and absorbed here: reads fail open (the circuit counts as passable),
 * writes are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerService {

    private final CircuitStateStore store;
    private final MarqueeProperties properties;
    private final Clock clock;

    @PostConstruct
    public void initialize() {
        Instant now = clock.instant();
        for (CircuitDefinition definition : CircuitRegistry.all()) {
            try {
                boolean created = store.createIfAbsent(CircuitBreakerState.builder()
                        .circuitId(definition.circuitId())
                        .circuitType(definition.type())
                        .state(definition.defaultState())
                        .defaultState(definition.defaultState())
                        .description(definition.description())
                        .failureThreshold(definition.type() == CircuitType.PROVIDER
                                ? properties.getCircuit().getDefaultFailureThreshold()
                                : definition.failureThreshold())
                        .failureCount(0)
                        .successCount(0)
                        .stateChangedAt(now)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                if (created) {
                    log.info("Circuit created circuitId={} state={}", definition.circuitId(), definition.defaultState());
                }
            } catch (RuntimeException e) {
                log.warn("Circuit initialization failed circuitId={}", definition.circuitId(), e);
            }
        }
    }

    /**
     * True only when the stored state is OFF.
     */
    public boolean isCircuitOpen(String circuitId) {
        try {
            return store.find(circuitId)
                    .map(state -> state.getState() == CircuitState.OFF)
                    .orElse(false);
        } catch (RuntimeException e) {
            log.warn("Circuit read failed circuitId={}, treating as closed", circuitId, e);
            return false;
        }
    }

    /**
     * Sleep mode blocks updates while its switch is ON; the master switch blocks while OFF.
     */
    public boolean isUpdateBlocked() {
        return isCircuitOpen(CircuitRegistry.MASTER) || isSleepModeActive();
    }

    public boolean isSleepModeActive() {
        try {
            return store.find(CircuitRegistry.SLEEP_MODE)
                    .map(state -> state.getState() == CircuitState.ON)
                    .orElse(false);
        } catch (RuntimeException e) {
            log.warn("Sleep mode read failed, treating as inactive", e);
            return false;
        }
    }

    public void setCircuitState(String circuitId, CircuitState state) {
        try {
            store.updateState(circuitId, state, clock.instant());
            log.info("Circuit state set circuitId={} state={}", circuitId, state);
        } catch (RuntimeException e) {
            log.warn("Circuit state update failed circuitId={} state={}", circuitId, state, e);
        }
    }

    public Optional<CircuitBreakerState> getCircuitStatus(String circuitId) {
        try {
            return store.find(circuitId);
        } catch (RuntimeException e) {
            log.warn("Circuit read failed circuitId={}", circuitId, e);
            return Optional.empty();
        }
    }

    public List<CircuitBreakerState> getAllCircuits() {
        try {
            return store.findAll();
        } catch (RuntimeException e) {
            log.warn("Circuit listing failed", e);
            return List.of();
        }
    }

    public List<CircuitBreakerState> getCircuitsByType(CircuitType type) {
        try {
            return store.findByType(type);
        } catch (RuntimeException e) {
            log.warn("Circuit listing failed type={}", type, e);
            return List.of();
        }
    }

    /**
     * Counts a failed provider call and trips the circuit when the policy says so. Authentication failures
     * trip an ON circuit immediately; any failure while HALF_OPEN trips.
     */
    public void recordProviderFailure(String circuitId, Throwable error) {
        try {
            Instant now = clock.instant();
            store.incrementFailureCount(circuitId, now);
            Optional<CircuitBreakerState> current = store.find(circuitId);
            if (current.isEmpty()) {
                return;
            }
            CircuitBreakerState state = current.get();
            int effectiveThreshold = error instanceof AuthenticationException ? 1 : state.getFailureThreshold();
            boolean trip = state.getState() == CircuitState.HALF_OPEN
                    || (state.getState() == CircuitState.ON && state.getFailureCount() >= effectiveThreshold);
            if (trip) {
                store.updateState(circuitId, CircuitState.OFF, now);
                log.warn("Provider circuit tripped circuitId={} from={} failures={} cause={}",
                        circuitId, state.getState(), state.getFailureCount(),
                        error != null ? error.getClass().getSimpleName() : "unknown");
            }
        } catch (RuntimeException e) {
            log.warn("Recording provider failure failed circuitId={}", circuitId, e);
        }
    }

    public void recordProviderSuccess(String circuitId) {
        try {
            Instant now = clock.instant();
            store.incrementSuccessCount(circuitId, now);
            Optional<CircuitBreakerState> current = store.find(circuitId);
            if (current.isEmpty()) {
                return;
            }
            CircuitBreakerState state = current.get();
            if (state.getState() == CircuitState.HALF_OPEN
                    && state.getSuccessCount() >= properties.getCircuit().getHalfOpenSuccessThreshold()) {
                store.updateState(circuitId, CircuitState.ON, now);
                store.resetCounters(circuitId, now);
                log.info("Provider circuit recovered circuitId={} successes={}", circuitId, state.getSuccessCount());
            }
        } catch (RuntimeException e) {
            log.warn("Recording provider success failed circuitId={}", circuitId, e);
        }
    }

    /**
     * ON and HALF_OPEN allow traffic. OFF allows traffic only after the reset timeout, in which case the circuit
     * moves to HALF_OPEN here so the next calls act as probes. Unknown circuits and storage errors allow traffic.
     */
    public boolean isProviderAvailable(String circuitId) {
        try {
            Optional<CircuitBreakerState> current = store.find(circuitId);
            if (current.isEmpty()) {
                return true;
            }
            CircuitBreakerState state = current.get();
            if (state.getState() != CircuitState.OFF) {
                return true;
            }
            if (!resetTimeoutElapsed(state)) {
                return false;
            }
            Instant now = clock.instant();
            store.updateState(circuitId, CircuitState.HALF_OPEN, now);
            store.resetCounters(circuitId, now);
            log.info("Provider circuit half-open circuitId={}", circuitId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Provider availability check failed circuitId={}, allowing traffic", circuitId, e);
            return true;
        }
    }

    public Optional<ProviderCircuitStatus> getProviderStatus(String circuitId) {
        try {
            return store.find(circuitId).map(state -> ProviderCircuitStatus.builder()
                    .circuitId(state.getCircuitId())
                    .state(state.getState())
                    .failureCount(state.getFailureCount())
                    .successCount(state.getSuccessCount())
                    .failureThreshold(state.getFailureThreshold())
                    .lastFailureAt(state.getLastFailureAt())
                    .lastSuccessAt(state.getLastSuccessAt())
                    .stateChangedAt(state.getStateChangedAt())
                    .canAttempt(state.getState() != CircuitState.OFF)
                    .resetTimeoutMs(resetTimeout().toMillis())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Provider status read failed circuitId={}", circuitId, e);
            return Optional.empty();
        }
    }

    public void resetProviderCircuit(String circuitId) {
        try {
            Instant now = clock.instant();
            store.updateState(circuitId, CircuitState.ON, now);
            store.resetCounters(circuitId, now);
            log.info("Provider circuit reset circuitId={}", circuitId);
        } catch (RuntimeException e) {
            log.warn("Provider circuit reset failed circuitId={}", circuitId, e);
        }
    }

    private boolean resetTimeoutElapsed(CircuitBreakerState state) {
        Instant changedAt = state.getStateChangedAt();
        if (changedAt == null) {
            return true;
        }
        return !clock.instant().isBefore(changedAt.plus(resetTimeout()));
    }

    private Duration resetTimeout() {
        return properties.getCircuit().getResetTimeout();
    }
}
