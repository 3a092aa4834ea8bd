package com.marquee.backend.service;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.ContentData;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import com.marquee.backend.service.circuit.CircuitRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for major updates from the cron trigger and the API. Honors the master and sleep-mode switches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MajorUpdateService {

    private final ContentOrchestrator orchestrator;
    private final CircuitBreakerService circuitBreakerService;
    private final MarqueeProperties properties;
    private final Clock clock;

    /**
     * Runs one major update, or returns empty when updates are switched off. Dry runs ignore the switches.
     */
    public Optional<GeneratedContent> trigger(String generatorId, Map<String, Object> eventData,
                                              ContentData contentData, boolean promptsOnly) {
        if (!promptsOnly && circuitBreakerService.isUpdateBlocked()) {
            log.info("Major update skipped reason=blocked master_off={} sleep_mode={}",
                    circuitBreakerService.isCircuitOpen(CircuitRegistry.MASTER),
                    circuitBreakerService.isSleepModeActive());
            return Optional.empty();
        }
        GenerationContext context = GenerationContext.major(clock.instant()).toBuilder()
                .generatorId(generatorId)
                .eventData(eventData)
                .contentData(contentData)
                .promptsOnly(promptsOnly)
                .useToolBasedGeneration(properties.getContent().isToolBasedGeneration())
                .build();
        return Optional.of(orchestrator.generateAndSend(context));
    }
}
