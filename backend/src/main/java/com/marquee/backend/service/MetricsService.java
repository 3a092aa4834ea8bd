package com.marquee.backend.service;

import com.marquee.backend.model.CircuitState;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import com.marquee.backend.service.circuit.CircuitDefinition;
import com.marquee.backend.service.circuit.CircuitRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;
    private final CircuitBreakerService circuitBreakerService;

    private Counter majorUpdatesCounter;
    private Counter fallbacksCounter;
    private Counter displaySendsCounter;
    private Counter displayFailuresCounter;

    @PostConstruct
    void init() {
        majorUpdatesCounter = Counter.builder("content_major_updates_total").register(meterRegistry);
        fallbacksCounter = Counter.builder("content_fallbacks_total").register(meterRegistry);
        displaySendsCounter = Counter.builder("display_sends_total").register(meterRegistry);
        displayFailuresCounter = Counter.builder("display_failures_total").register(meterRegistry);
        for (CircuitDefinition definition : CircuitRegistry.PROVIDER_CIRCUITS) {
            Gauge.builder("provider_circuit_state", circuitBreakerService,
                            service -> circuitStateValue(service, definition.circuitId()))
                    .tag("circuit", definition.circuitId())
                    .register(meterRegistry);
        }
    }

    public void recordMajorUpdate() {
        if (majorUpdatesCounter != null) {
            majorUpdatesCounter.increment();
        }
    }

    public void recordFallback(String reason) {
        if (fallbacksCounter != null) {
            fallbacksCounter.increment();
        }
        meterRegistry.counter("content_fallbacks_by_reason_total", "reason", reason).increment();
    }

    public void recordDisplaySend(boolean success) {
        Counter counter = success ? displaySendsCounter : displayFailuresCounter;
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordMinorUpdate(String outcome) {
        meterRegistry.counter("content_minor_updates_total", "outcome", outcome).increment();
    }

    public void recordScheduledTaskFailure(String taskName) {
        meterRegistry.counter("scheduled_task_failures_total", "task", taskName).increment();
    }

    private static double circuitStateValue(CircuitBreakerService service, String circuitId) {
        return service.getCircuitStatus(circuitId)
                .map(state -> mapState(state.getState()))
                .orElse(-1.0);
    }

    private static double mapState(CircuitState state) {
        return switch (state) {
            case ON -> 0;
            case OFF -> 1;
            case HALF_OPEN -> 2;
        };
    }
}
