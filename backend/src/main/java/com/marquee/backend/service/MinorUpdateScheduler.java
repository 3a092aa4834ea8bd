package com.marquee.backend.service;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.MinorUpdateOutcome;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import com.marquee.backend.service.content.MinorUpdateGenerator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * Minute-aligned minor updates. {@link #start()} waits for the next wall-clock minute, runs one cycle there
 * and then repeats every 60 seconds until {@link #stop()}.
 */
@Slf4j
@Component
public class MinorUpdateScheduler {

    static final Duration PERIOD = Duration.ofSeconds(60);

    private final TaskScheduler taskScheduler;
    private final ContentOrchestrator orchestrator;
    private final MinorUpdateGenerator minorUpdateGenerator;
    private final CircuitBreakerService circuitBreakerService;
    private final MetricsService metricsService;
    private final MarqueeProperties properties;
    private final Clock clock;

    private final Object monitor = new Object();
    private ScheduledFuture<?> alignmentTask;
    private ScheduledFuture<?> recurringTask;
    private boolean started;

    public MinorUpdateScheduler(@Qualifier("minorUpdateTaskScheduler") TaskScheduler taskScheduler,
                                ContentOrchestrator orchestrator,
                                MinorUpdateGenerator minorUpdateGenerator,
                                CircuitBreakerService circuitBreakerService,
                                MetricsService metricsService,
                                MarqueeProperties properties,
                                Clock clock) {
        this.taskScheduler = taskScheduler;
        this.orchestrator = orchestrator;
        this.minorUpdateGenerator = minorUpdateGenerator;
        this.circuitBreakerService = circuitBreakerService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getScheduler().getMinor().isEnabled()) {
            start();
        } else {
            log.info("Minor update scheduler disabled");
        }
    }

    public void start() {
        synchronized (monitor) {
            if (started) {
                return;
            }
            Instant now = clock.instant();
            long delayMs = millisUntilNextMinute(now);
            alignmentTask = taskScheduler.schedule(this::onMinuteBoundary, now.plusMillis(delayMs));
            started = true;
            log.info("Minor update scheduler started firstRunInMs={}", delayMs);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (monitor) {
            if (alignmentTask != null) {
                alignmentTask.cancel(false);
                alignmentTask = null;
            }
            if (recurringTask != null) {
                recurringTask.cancel(false);
                recurringTask = null;
            }
            if (started) {
                log.info("Minor update scheduler stopped");
            }
            started = false;
        }
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return started;
        }
    }

    void onMinuteBoundary() {
        synchronized (monitor) {
            if (!started) {
                return;
            }
            alignmentTask = null;
            recurringTask = taskScheduler.scheduleAtFixedRate(this::runCycle, clock.instant().plus(PERIOD), PERIOD);
        }
        runCycle();
    }

    /**
     * One minor-update cycle. Never throws.
     */
    public MinorUpdateOutcome runCycle() {
        MinorUpdateOutcome outcome;
        try {
            if (circuitBreakerService.isUpdateBlocked()) {
                outcome = MinorUpdateOutcome.SKIPPED_BLOCKED;
            } else {
                outcome = orchestrator.sendMinorUpdate(minorUpdateGenerator, clock.instant());
            }
        } catch (RuntimeException e) {
            log.error("Minor update failed", e);
            outcome = MinorUpdateOutcome.FAILED;
        }
        if (outcome == MinorUpdateOutcome.SENT) {
            log.debug("Minor update sent");
        } else if (outcome != MinorUpdateOutcome.FAILED) {
            log.info("Minor update skipped reason={}", outcome);
        }
        metricsService.recordMinorUpdate(outcome.name());
        return outcome;
    }

    /**
     * Milliseconds from {@code now} to the next whole minute: {@code (60 - seconds) * 1000 - millis}.
     */
    public static long millisUntilNextMinute(Instant now) {
        ZonedDateTime time = now.atZone(ZoneOffset.UTC);
        int seconds = time.getSecond();
        int millis = time.getNano() / 1_000_000;
        return (60L - seconds) * 1000L - millis;
    }
}
