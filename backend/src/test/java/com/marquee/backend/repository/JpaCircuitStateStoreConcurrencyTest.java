package com.marquee.backend.repository;

import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaCircuitStateStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaCircuitStateStoreConcurrencyTest {

    private static final String CIRCUIT_ID = "PROVIDER_CONCURRENT";
    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");
    private static final int THREADS = 4;
    private static final int INCREMENTS_PER_THREAD = 25;

    @Autowired
    private JpaCircuitStateStore store;

    @Autowired
    private CircuitBreakerStateRepository repository;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        store.createIfAbsent(CircuitBreakerState.builder()
                .circuitId(CIRCUIT_ID)
                .circuitType(CircuitType.PROVIDER)
                .state(CircuitState.ON)
                .defaultState(CircuitState.ON)
                .failureThreshold(5)
                .failureCount(0)
                .successCount(0)
                .stateChangedAt(NOW)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build());

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                tasks.add(() -> {
                    for (int n = 0; n < INCREMENTS_PER_THREAD; n++) {
                        store.incrementFailureCount(CIRCUIT_ID, NOW);
                        store.incrementSuccessCount(CIRCUIT_ID, NOW);
                    }
                    return null;
                });
            }
            for (Future<Void> result : executor.invokeAll(tasks)) {
                result.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        CircuitBreakerState state = store.find(CIRCUIT_ID).orElseThrow();
        assertThat(state.getFailureCount()).isEqualTo(THREADS * INCREMENTS_PER_THREAD);
        assertThat(state.getSuccessCount()).isEqualTo(THREADS * INCREMENTS_PER_THREAD);
        assertThat(state.getLastFailureAt()).isEqualTo(NOW);
    }
}
