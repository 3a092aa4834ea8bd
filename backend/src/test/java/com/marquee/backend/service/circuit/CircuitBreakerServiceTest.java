package com.marquee.backend.service.circuit;

import com.marquee.backend.MutableClock;
import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.exception.AuthenticationException;
import com.marquee.backend.exception.RateLimitException;
import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;
import com.marquee.backend.repository.CircuitStateStore;
import com.marquee.backend.repository.InMemoryCircuitStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CircuitBreakerServiceTest {

    private static final String OPENAI = CircuitRegistry.PROVIDER_OPENAI;

    private InMemoryCircuitStateStore store;
    private MutableClock clock;
    private CircuitBreakerService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryCircuitStateStore();
        clock = new MutableClock(Instant.parse("2024-03-15T10:00:00Z"));
        service = new CircuitBreakerService(store, new MarqueeProperties(), clock);
        service.initialize();
    }

    @Test
    void initializeCreatesEveryCircuitWithItsDefaultState() {
        assertThat(service.getAllCircuits()).extracting(CircuitBreakerState::getCircuitId)
                .containsExactly("MASTER", "PROVIDER_ANTHROPIC", "PROVIDER_OPENAI", "SLEEP_MODE");
        assertThat(service.getCircuitStatus("MASTER")).get()
                .extracting(CircuitBreakerState::getState).isEqualTo(CircuitState.ON);
        assertThat(service.getCircuitStatus("SLEEP_MODE")).get()
                .extracting(CircuitBreakerState::getState).isEqualTo(CircuitState.OFF);
        assertThat(service.getCircuitsByType(CircuitType.PROVIDER))
                .allSatisfy(row -> {
                    assertThat(row.getState()).isEqualTo(CircuitState.ON);
                    assertThat(row.getFailureThreshold()).isEqualTo(5);
                });
    }

    @Test
    void initializeKeepsPersistedStateAcrossRestarts() {
        service.setCircuitState(CircuitRegistry.MASTER, CircuitState.OFF);

        new CircuitBreakerService(store, new MarqueeProperties(), clock).initialize();

        assertThat(service.isCircuitOpen(CircuitRegistry.MASTER)).isTrue();
    }

    @Test
    void updatesBlockedWhenMasterOffOrSleepModeOn() {
        assertThat(service.isUpdateBlocked()).isFalse();

        service.setCircuitState(CircuitRegistry.SLEEP_MODE, CircuitState.ON);
        assertThat(service.isSleepModeActive()).isTrue();
        assertThat(service.isUpdateBlocked()).isTrue();

        service.setCircuitState(CircuitRegistry.SLEEP_MODE, CircuitState.OFF);
        service.setCircuitState(CircuitRegistry.MASTER, CircuitState.OFF);
        assertThat(service.isUpdateBlocked()).isTrue();
    }

    @Test
    void unknownCircuitIsNeverOpen() {
        assertThat(service.isCircuitOpen("NOPE")).isFalse();
        assertThat(service.getCircuitStatus("NOPE")).isEmpty();
        assertThat(service.isProviderAvailable("PROVIDER_NOPE")).isTrue();
    }

    @Test
    void providerTripsWhenFailuresReachThreshold() {
        for (int i = 0; i < 4; i++) {
            service.recordProviderFailure(OPENAI, new RateLimitException("openai", "slow down"));
        }
        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.ON);
        assertThat(state(OPENAI).getFailureCount()).isEqualTo(4);

        service.recordProviderFailure(OPENAI, new RateLimitException("openai", "slow down"));

        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.OFF);
        assertThat(service.isProviderAvailable(OPENAI)).isFalse();
    }

    @Test
    void authenticationFailureTripsImmediately() {
        service.recordProviderFailure(OPENAI, new AuthenticationException("openai", "bad key"));

        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.OFF);
    }

    @Test
    void offCircuitMovesToHalfOpenOnceResetTimeoutElapses() {
        service.recordProviderFailure(OPENAI, new AuthenticationException("openai", "bad key"));

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(service.isProviderAvailable(OPENAI)).isFalse();
        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.OFF);

        clock.advance(Duration.ofMillis(1));
        assertThat(service.isProviderAvailable(OPENAI)).isTrue();
        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(state(OPENAI).getFailureCount()).isZero();
        assertThat(state(OPENAI).getSuccessCount()).isZero();
    }

    @Test
    void halfOpenFailureTripsAgain() {
        service.setCircuitState(OPENAI, CircuitState.HALF_OPEN);

        service.recordProviderFailure(OPENAI, new RateLimitException("openai", "still busy"));

        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.OFF);
        assertThat(state(OPENAI).getStateChangedAt()).isEqualTo(clock.instant());
    }

    @Test
    void halfOpenClosesAfterConfiguredSuccesses() {
        service.setCircuitState(OPENAI, CircuitState.HALF_OPEN);

        service.recordProviderSuccess(OPENAI);
        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.HALF_OPEN);

        service.recordProviderSuccess(OPENAI);
        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.ON);
        assertThat(state(OPENAI).getSuccessCount()).isZero();
    }

    @Test
    void successWhileOnDoesNotResetFailureCount() {
        service.recordProviderFailure(OPENAI, new RateLimitException("openai", "slow down"));
        service.recordProviderSuccess(OPENAI);

        assertThat(state(OPENAI).getFailureCount()).isEqualTo(1);
        assertThat(state(OPENAI).getSuccessCount()).isEqualTo(1);
    }

    @Test
    void resetProviderCircuitRestoresOnWithZeroCounters() {
        service.recordProviderFailure(OPENAI, new AuthenticationException("openai", "bad key"));

        service.resetProviderCircuit(OPENAI);

        assertThat(state(OPENAI).getState()).isEqualTo(CircuitState.ON);
        assertThat(state(OPENAI).getFailureCount()).isZero();
    }

    @Test
    void providerStatusReportsResetTimeoutAndAttemptability() {
        service.recordProviderFailure(OPENAI, new AuthenticationException("openai", "bad key"));

        assertThat(service.getProviderStatus(OPENAI)).get().satisfies(status -> {
            assertThat(status.state()).isEqualTo(CircuitState.OFF);
            assertThat(status.canAttempt()).isFalse();
            assertThat(status.failureCount()).isEqualTo(1);
            assertThat(status.resetTimeoutMs()).isEqualTo(300_000L);
        });
    }

    @Test
    void storageFailuresDegradeToPermissiveDefaults() {
        CircuitStateStore broken = mock(CircuitStateStore.class);
        IllegalStateException down = new IllegalStateException("database down");
        when(broken.find(anyString())).thenThrow(down);
        when(broken.findAll()).thenThrow(down);
        when(broken.findByType(any())).thenThrow(down);
        when(broken.createIfAbsent(any())).thenThrow(down);
        CircuitBreakerService degraded = new CircuitBreakerService(broken, new MarqueeProperties(), clock);

        assertThatCode(degraded::initialize).doesNotThrowAnyException();
        assertThat(degraded.isCircuitOpen(CircuitRegistry.MASTER)).isFalse();
        assertThat(degraded.isUpdateBlocked()).isFalse();
        assertThat(degraded.isProviderAvailable(OPENAI)).isTrue();
        assertThat(degraded.getAllCircuits()).isEmpty();
        assertThat(degraded.getCircuitsByType(CircuitType.MANUAL)).isEmpty();
        assertThat(degraded.getCircuitStatus(OPENAI)).isEmpty();
        assertThatCode(() -> degraded.recordProviderFailure(OPENAI, new RuntimeException("x")))
                .doesNotThrowAnyException();
        assertThatCode(() -> degraded.recordProviderSuccess(OPENAI)).doesNotThrowAnyException();
    }

    private CircuitBreakerState state(String circuitId) {
        return store.find(circuitId).orElseThrow();
    }
}
