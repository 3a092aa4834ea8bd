package com.marquee.backend.service;

import com.marquee.backend.service.circuit.CircuitBreakerService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ScheduledTaskGuardTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ScheduledTaskGuard guard = new ScheduledTaskGuard(
            new MetricsService(registry, mock(CircuitBreakerService.class)));

    @Test
    void runsTask() {
        AtomicInteger runs = new AtomicInteger();

        assertThat(guard.run("major-update", runs::incrementAndGet)).isTrue();

        assertThat(runs).hasValue(1);
        assertThat(registry.find("scheduled_task_failures_total").counter()).isNull();
    }

    @Test
    void failureIsCountedNotThrown() {
        boolean ok = guard.run("major-update", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(ok).isFalse();
        assertThat(registry.get("scheduled_task_failures_total").tag("task", "major-update").counter().count())
                .isEqualTo(1.0);
    }
}
