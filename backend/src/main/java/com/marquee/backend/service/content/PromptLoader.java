package com.marquee.backend.service.content;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates from {@code classpath:prompts/}, cached after first read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptLoader {

    private static final String BASE_LOCATION = "classpath:prompts/";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public boolean exists(String path) {
        return resourceLoader.getResource(BASE_LOCATION + path).exists();
    }

    public Optional<String> load(String path) {
        String cached = cache.get(path);
        if (cached != null) {
            return Optional.of(cached);
        }
        Resource resource = resourceLoader.getResource(BASE_LOCATION + path);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            cache.put(path, text);
            return Optional.of(text);
        } catch (IOException e) {
            log.warn("Prompt read failed path={}", path, e);
            return Optional.empty();
        }
    }

    public String require(String path) {
        return load(path).orElseThrow(() -> new IllegalStateException("Prompt not found: prompts/" + path));
    }
}
