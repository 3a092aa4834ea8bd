package com.marquee.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.CachedContent;
import com.marquee.backend.model.DisplayLayout;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.MinorUpdateOutcome;
import com.marquee.backend.model.OutputMode;
import com.marquee.backend.model.ValidationResult;
import com.marquee.backend.service.ai.AiProvider;
import com.marquee.backend.service.ai.AiProviderRegistry;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import com.marquee.backend.service.circuit.CircuitRecordingAiProvider;
import com.marquee.backend.service.circuit.CircuitRegistry;
import com.marquee.backend.service.content.ContentSelector;
import com.marquee.backend.service.content.GeneratorFactory;
import com.marquee.backend.service.content.MinorUpdateGenerator;
import com.marquee.backend.service.content.RegisteredGenerator;
import com.marquee.backend.service.content.StaticFallbackGenerator;
import com.marquee.backend.service.content.SubmitContentTool;
import com.marquee.backend.service.content.ToolBasedGenerator;
import com.marquee.backend.service.display.DisplayClient;
import com.marquee.backend.service.frame.FrameDecorator;
import com.marquee.backend.service.frame.FrameResult;
import com.marquee.backend.util.CharacterConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Major-update pipeline: select, bind providers by circuit state, generate with failover, validate, fall back,
 * decorate, cache, send. Generation failures never escape; the static fallback absorbs them.
 * <p>
 * Decorate, cache and send run under one lock that the minor-update path shares, so a minute tick never
 * interleaves with a major update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentOrchestrator {

    private final ContentSelector contentSelector;
    private final CircuitBreakerService circuitBreakerService;
    private final AiProviderRegistry aiProviderRegistry;
    private final ProviderFailoverService providerFailoverService;
    private final ContentValidator contentValidator;
    private final StaticFallbackGenerator fallbackGenerator;
    private final SubmitContentTool submitContentTool;
    private final FrameDecorator frameDecorator;
    private final DisplayClient displayClient;
    private final ContentHistoryService contentHistoryService;
    private final MetricsService metricsService;
    private final MarqueeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock sendLock = new ReentrantLock();
    private volatile CachedContent cache;

    public GeneratedContent generateAndSend(GenerationContext context) {
        Optional<RegisteredGenerator> selected = contentSelector.select(context);
        if (context.promptsOnly()) {
            return dryRun(selected, context);
        }

        GeneratedContent content = null;
        RegisteredGenerator used = selected.orElse(null);
        String fallbackReason = null;

        if (used == null) {
            fallbackReason = "no generator registered";
        } else {
            try {
                content = runGenerator(used, context);
                ValidationResult validation = contentValidator.validate(content);
                if (!validation.valid()) {
                    fallbackReason = "validation failed: " + validation.firstError();
                    log.warn("Generated content invalid generator={} errors={}", used.name(), validation.errors());
                    contentHistoryService.recordFailure(context, used.id(), used.name(),
                            new IllegalStateException(fallbackReason));
                    content = null;
                }
            } catch (RuntimeException e) {
                fallbackReason = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("Content generation failed generator={} cause={}", used.name(), e.toString());
                contentHistoryService.recordFailure(context, used.id(), used.name(), e);
            }
        }

        FormatOptions formatOptions = used != null ? used.registration().formatOptionsOrDefault() : FormatOptions.DEFAULT;
        String generatorId = used != null ? used.id() : null;
        String generatorName = used != null ? used.name() : null;
        Integer priority = used != null ? used.registration().priority().getLevel() : null;

        if (content == null) {
            metricsService.recordFallback(fallbackReason.startsWith("validation") ? "validation" : "generation");
            Map<String, Object> fallbackMetadata = new LinkedHashMap<>();
            fallbackMetadata.put("fallback", true);
            fallbackMetadata.put("fallbackReason", fallbackReason);
            if (used != null) {
                fallbackMetadata.put("failedGenerator", used.name());
            }
            content = fallbackGenerator.generate(context).withMetadata(fallbackMetadata);
            formatOptions = FormatOptions.DEFAULT;
            generatorId = StaticFallbackGenerator.ID;
            generatorName = "Static fallback";
            priority = 3;
        }

        GeneratedContent sent = decorateCacheAndSend(content, context, formatOptions, generatorId);
        metricsService.recordMajorUpdate();
        contentHistoryService.recordSuccess(context, sent, generatorId, generatorName, priority, clock.instant());
        log.info("Major update sent generator={} provider={} fallback={}",
                generatorId, sent.metadataValue("provider"), sent.metadataValue("fallback") != null);
        return sent;
    }

    /**
     * Regenerates the frame for the cached text under the send lock and pushes it to the display.
     */
    public MinorUpdateOutcome sendMinorUpdate(MinorUpdateGenerator generator, Instant timestamp) {
        sendLock.lock();
        try {
            CachedContent cached = cache;
            if (cached == null) {
                return MinorUpdateOutcome.SKIPPED_NO_CACHE;
            }
            if (generator.shouldSkip()) {
                return MinorUpdateOutcome.SKIPPED_FULL_LAYOUT;
            }
            GeneratedContent minor = generator.generate(GenerationContext.minor(timestamp).toBuilder()
                    .contentData(cached.contentData())
                    .build());
            if (minor.layout() == null || !minor.layout().hasCharacterCodes()) {
                throw new IllegalStateException("Minor update must produce a layout with character codes");
            }
            displayClient.sendLayout(minor.layout().characterCodes());
            return MinorUpdateOutcome.SENT;
        } finally {
            sendLock.unlock();
        }
    }

    public Optional<GeneratedContent> getCachedContent() {
        CachedContent cached = cache;
        return cached == null ? Optional.empty() : Optional.of(cached.content());
    }

    public Optional<CachedContent> getCachedEntry() {
        return Optional.ofNullable(cache);
    }

    public void clearCache() {
        sendLock.lock();
        try {
            cache = null;
        } finally {
            sendLock.unlock();
        }
    }

    private GeneratedContent runGenerator(RegisteredGenerator generator, GenerationContext context) {
        Map<String, Object> identity = Map.of("generatorId", generator.id(), "generatorName", generator.name());
        if (!generator.requiresAi()) {
            return generator.factory().create(null).generate(context).withMetadata(identity);
        }

        List<AiProvider> available = aiProviderRegistry.orderedProviders().stream()
                .filter(provider -> circuitBreakerService.isProviderAvailable(
                        CircuitRegistry.providerCircuitId(provider.getName())))
                .map(provider -> (AiProvider) new CircuitRecordingAiProvider(provider, circuitBreakerService))
                .toList();
        if (available.isEmpty()) {
            throw new IllegalStateException("No AI provider available");
        }
        AiProvider preferred = available.get(0);
        AiProvider alternate = available.size() > 1 ? available.get(1) : null;

        GeneratorFactory factory = context.useToolBasedGeneration()
                ? toolBased(generator.factory())
                : generator.factory();
        return providerFailoverService.run(factory, context, preferred, alternate).withMetadata(identity);
    }

    private GeneratorFactory toolBased(GeneratorFactory base) {
        MarqueeProperties.Tool tool = properties.getTool();
        return provider -> new ToolBasedGenerator(base.create(provider), provider, submitContentTool, objectMapper,
                tool.getMaxAttempts(), tool.getExhaustionStrategy());
    }

    private GeneratedContent dryRun(Optional<RegisteredGenerator> selected, GenerationContext context) {
        RegisteredGenerator generator = selected.orElseThrow(
                () -> new IllegalStateException("No generator registered for dry run"));
        return generator.factory().create(null).generate(context)
                .withMetadata(Map.of("generatorId", generator.id(), "generatorName", generator.name()));
    }

    private GeneratedContent decorateCacheAndSend(GeneratedContent content, GenerationContext context,
                                                  FormatOptions formatOptions, String generatorId) {
        sendLock.lock();
        try {
            int[][] codes;
            if (content.outputMode() == OutputMode.TEXT) {
                FrameResult frame = frameDecorator.decorate(content.text(), context.timestamp(),
                        context.contentData(), formatOptions);
                if (!frame.warnings().isEmpty()) {
                    log.info("Frame decorated with warnings generator={} warnings={}", generatorId, frame.warnings());
                }
                codes = frame.layout();
            } else if (content.layout().hasCharacterCodes()) {
                codes = content.layout().characterCodes();
            } else {
                codes = CharacterConverter.rowsToLayout(content.layout().rows());
            }
            GeneratedContent decorated = new GeneratedContent(content.text(), content.outputMode(),
                    content.outputMode() == OutputMode.TEXT
                            ? DisplayLayout.ofCodes(codes)
                            : new DisplayLayout(codes, content.layout().rows()),
                    content.metadata());
            cache = new CachedContent(decorated, formatOptions, context.contentData(), generatorId);
            displayClient.sendLayout(codes);
            return decorated;
        } finally {
            sendLock.unlock();
        }
    }
}
