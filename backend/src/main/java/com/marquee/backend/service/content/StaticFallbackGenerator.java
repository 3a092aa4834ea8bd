package com.marquee.backend.service.content;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.GeneratorValidationResult;
import com.marquee.backend.service.ContentValidator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * FALLBACK-priority generator: a random pre-written message from {@code fallback/*.txt}. Messages that would not pass
 * validation are dropped at load time so the output is always displayable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaticFallbackGenerator implements ContentGenerator {

    public static final String ID = "static-fallback";
    static final String BUILT_IN_MESSAGE = "HELLO FROM\nMARQUEE";

    private final ResourcePatternResolver resourcePatternResolver;
    private final ContentValidator validator;
    private final MarqueeProperties properties;
    private final Random random = new Random();

    private volatile List<FallbackMessage> messages = List.of();

    @PostConstruct
    public void load() {
        List<FallbackMessage> loaded = new ArrayList<>();
        String location = properties.getContent().getFallbackLocation();
        try {
            for (Resource resource : resourcePatternResolver.getResources(location)) {
                readMessage(resource, loaded);
            }
        } catch (IOException e) {
            log.warn("Fallback messages unavailable location={}", location, e);
        }
        messages = List.copyOf(loaded);
        log.info("Fallback messages loaded count={} location={}", loaded.size(), location);
    }

    private void readMessage(Resource resource, List<FallbackMessage> target) {
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim().toUpperCase();
            if (validator.validateText(text).valid()) {
                target.add(new FallbackMessage(resource.getFilename(), text));
            } else {
                log.warn("Fallback message skipped file={} reason=invalid", resource.getFilename());
            }
        } catch (IOException e) {
            log.warn("Fallback message unreadable file={}", resource.getFilename(), e);
        }
    }

    @Override
    public GeneratorValidationResult validate() {
        if (properties.getContent().getFallbackLocation() == null
                || properties.getContent().getFallbackLocation().isBlank()) {
            return GeneratorValidationResult.invalid("Fallback location is empty");
        }
        return GeneratorValidationResult.ok();
    }

    @Override
    public GeneratedContent generate(GenerationContext context) {
        List<FallbackMessage> available = messages;
        if (available.isEmpty()) {
            return GeneratedContent.text(BUILT_IN_MESSAGE, Map.of("source", ID, "file", "built-in"));
        }
        FallbackMessage message = available.get(random.nextInt(available.size()));
        return GeneratedContent.text(message.text(), Map.of("source", ID, "file", message.file()));
    }

    List<FallbackMessage> messages() {
        return messages;
    }

    record FallbackMessage(String file, String text) {}
}
