package com.marquee.backend.service.ai;

import com.marquee.backend.config.MarqueeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Configured providers in preference order: the configured primary first, the rest after it.
 */
@Slf4j
@Component
public class AiProviderRegistry {

    private final List<AiProvider> ordered;

    public AiProviderRegistry(List<AiProvider> providers, MarqueeProperties properties) {
        String primary = properties.getProviders().getPrimary();
        List<AiProvider> configured = new ArrayList<>(providers.stream().filter(AiProvider::isConfigured).toList());
        configured.sort(Comparator.comparing(provider -> !provider.getName().equalsIgnoreCase(primary)));
        this.ordered = List.copyOf(configured);
        if (ordered.isEmpty()) {
            log.warn("No AI provider configured; every major update will use the static fallback");
        } else {
            log.info("AI providers configured order={}", ordered.stream().map(AiProvider::getName).toList());
        }
    }

    public List<AiProvider> orderedProviders() {
        return ordered;
    }

    public Optional<AiProvider> find(String name) {
        return ordered.stream().filter(provider -> provider.getName().equalsIgnoreCase(name)).findFirst();
    }
}
