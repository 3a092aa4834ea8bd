package com.marquee.backend.config;

import com.marquee.backend.model.ContentPriority;
import com.marquee.backend.model.ContentRegistration;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.service.ContentValidator;
import com.marquee.backend.service.content.ContentRegistry;
import com.marquee.backend.service.content.PromptLoader;
import com.marquee.backend.service.content.RegisteredGenerator;
import com.marquee.backend.service.content.StaticFallbackGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import static org.assertj.core.api.Assertions.assertThat;

class ContentRegistryConfigTest {

    private final MarqueeProperties properties = new MarqueeProperties();
    private final PromptLoader promptLoader = new PromptLoader(new DefaultResourceLoader());

    @Test
    void registersValidGeneratorsAndAlwaysTheFallback() {
        properties.getContent().getGenerators().add(generator("haiku", "user/haiku.txt", null));
        properties.getContent().getGenerators().add(generator("broken", "user/missing.txt", null));

        ContentRegistry registry = new ContentRegistryConfig().contentRegistry(properties, promptLoader, fallback());

        assertThat(registry.getAll()).extracting(RegisteredGenerator::id)
                .containsExactly("haiku", StaticFallbackGenerator.ID);
        assertThat(registry.getById("haiku")).get().extracting(RegisteredGenerator::requiresAi).isEqualTo(true);
        RegisteredGenerator fallback = registry.getById(StaticFallbackGenerator.ID).orElseThrow();
        assertThat(fallback.requiresAi()).isFalse();
        assertThat(fallback.registration().priority()).isEqualTo(ContentPriority.FALLBACK);
    }

    @Test
    void registrationCarriesPatternAndFormatting() {
        MarqueeProperties.Generator door = generator("door", "user/door-notification.txt", "^door\\.");
        door.setPriority(ContentPriority.NOTIFICATION);
        door.setTextAlign(FormatOptions.TextAlign.LEFT);
        door.setVerticalCenter(false);

        ContentRegistration registration = ContentRegistryConfig.toRegistration(door);

        assertThat(registration.eventTriggerPattern().matcher("door.opened").find()).isTrue();
        assertThat(registration.eventTriggerPattern().matcher("window.opened").find()).isFalse();
        assertThat(registration.formatOptions()).isEqualTo(new FormatOptions(FormatOptions.TextAlign.LEFT, false));
        assertThat(ContentRegistryConfig.toRegistration(generator("haiku", "user/haiku.txt", " "))
                .eventTriggerPattern()).isNull();
    }

    private StaticFallbackGenerator fallback() {
        return new StaticFallbackGenerator(new PathMatchingResourcePatternResolver(), new ContentValidator(),
                properties);
    }

    private static MarqueeProperties.Generator generator(String id, String userPrompt, String eventPattern) {
        MarqueeProperties.Generator generator = new MarqueeProperties.Generator();
        generator.setId(id);
        generator.setName(id);
        generator.setSystemPrompt("system/major-update-base.txt");
        generator.setUserPrompt(userPrompt);
        generator.setEventPattern(eventPattern);
        return generator;
    }
}
