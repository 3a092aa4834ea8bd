package com.marquee.backend.config;

import com.marquee.backend.model.ContentPriority;
import com.marquee.backend.model.ContentRegistration;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.model.GeneratorValidationResult;
import com.marquee.backend.service.content.AiPromptGenerator;
import com.marquee.backend.service.content.ContentRegistry;
import com.marquee.backend.service.content.ContentSelector;
import com.marquee.backend.service.content.GeneratorFactory;
import com.marquee.backend.service.content.PriorityContentSelector;
import com.marquee.backend.service.content.PromptLoader;
import com.marquee.backend.service.content.RegisteredGenerator;
import com.marquee.backend.service.content.StaticFallbackGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.regex.Pattern;

/**
 * Builds the generator registry from {@code marquee.content.generators} plus the built-in static fallback.
 */
@Slf4j
@Configuration
public class ContentRegistryConfig {

    @Bean
    public ContentRegistry contentRegistry(MarqueeProperties properties, PromptLoader promptLoader,
                                           StaticFallbackGenerator fallbackGenerator) {
        ContentRegistry registry = new ContentRegistry();
        for (MarqueeProperties.Generator generator : properties.getContent().getGenerators()) {
            GeneratorFactory factory = provider -> new AiPromptGenerator(generator.getId(), generator.getModelTier(),
                    generator.getSystemPrompt(), generator.getUserPrompt(), promptLoader, provider);
            GeneratorValidationResult validation = factory.create(null).validate();
            if (!validation.valid()) {
                log.warn("Generator skipped id={} errors={}", generator.getId(), validation.errors());
                continue;
            }
            registry.register(new RegisteredGenerator(toRegistration(generator), factory, true));
        }

        registry.register(new RegisteredGenerator(ContentRegistration.builder()
                .id(StaticFallbackGenerator.ID)
                .name("Static fallback")
                .priority(ContentPriority.FALLBACK)
                .modelTier("none")
                .formatOptions(FormatOptions.DEFAULT)
                .build(), provider -> fallbackGenerator, false));

        log.info("Content registry ready generators={}", registry.getAll().size());
        return registry;
    }

    @Bean
    public ContentSelector contentSelector(ContentRegistry contentRegistry) {
        return new PriorityContentSelector(contentRegistry, new Random());
    }

    static ContentRegistration toRegistration(MarqueeProperties.Generator generator) {
        Pattern eventPattern = generator.getEventPattern() == null || generator.getEventPattern().isBlank()
                ? null
                : Pattern.compile(generator.getEventPattern());
        return ContentRegistration.builder()
                .id(generator.getId())
                .name(generator.getName())
                .priority(generator.getPriority())
                .modelTier(generator.getModelTier())
                .eventTriggerPattern(eventPattern)
                .formatOptions(new FormatOptions(generator.getTextAlign(), generator.isVerticalCenter()))
                .build();
    }
}
