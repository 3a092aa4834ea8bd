package com.marquee.backend.repository;

import com.marquee.backend.model.CircuitBreakerState;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

@Repository
@RequiredArgsConstructor
public class JpaCircuitStateStore implements CircuitStateStore {

    private final CircuitBreakerStateRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<CircuitBreakerState> find(String circuitId) {
        return repository.findByCircuitId(circuitId).map(CircuitBreakerState::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CircuitBreakerState> findAll() {
        return repository.findAllByOrderByCircuitIdAsc().stream().map(CircuitBreakerState::copy).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CircuitBreakerState> findByType(CircuitType type) {
        return repository.findByCircuitTypeOrderByCircuitIdAsc(type).stream().map(CircuitBreakerState::copy).toList();
    }

    @Override
    @Transactional
    public boolean createIfAbsent(CircuitBreakerState state) {
        if (repository.existsByCircuitId(state.getCircuitId())) {
            return false;
        }
        repository.save(state.toBuilder().id(null).build());
        return true;
    }

    @Override
    @Transactional
    public void updateState(String circuitId, CircuitState state, Instant now) {
        mutate(circuitId, row -> {
            row.setState(state);
            row.setStateChangedAt(now);
            row.setUpdatedAt(now);
        });
    }

    @Override
    @Transactional
    public void incrementFailureCount(String circuitId, Instant now) {
        repository.incrementFailureCount(circuitId, now);
    }

    @Override
    @Transactional
    public void incrementSuccessCount(String circuitId, Instant now) {
        repository.incrementSuccessCount(circuitId, now);
    }

    @Override
    @Transactional
    public void resetCounters(String circuitId, Instant now) {
        mutate(circuitId, row -> {
            row.setFailureCount(0);
            row.setSuccessCount(0);
            row.setUpdatedAt(now);
        });
    }

    private void mutate(String circuitId, Consumer<CircuitBreakerState> change) {
        repository.findByCircuitId(circuitId).ifPresent(row -> {
            change.accept(row);
            repository.save(row);
        });
    }
}
