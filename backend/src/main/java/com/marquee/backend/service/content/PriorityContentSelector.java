package com.marquee.backend.service.content;

import com.marquee.backend.model.ContentPriority;
import com.marquee.backend.model.GenerationContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Explicit generator id first, then notifications matching the trigger event, then a random NORMAL-priority generator,
 * then the first FALLBACK-priority generator.
 */
@Slf4j
public class PriorityContentSelector implements ContentSelector {

    private final ContentRegistry registry;
    private final Random random;

    public PriorityContentSelector(ContentRegistry registry, Random random) {
        this.registry = registry;
        this.random = random;
    }

    @Override
    public Optional<RegisteredGenerator> select(GenerationContext context) {
        if (context.generatorId() != null && !context.generatorId().isBlank()) {
            Optional<RegisteredGenerator> forced = registry.getById(context.generatorId());
            if (forced.isPresent()) {
                return forced;
            }
            log.warn("Requested generator not registered generatorId={}, using priority selection",
                    context.generatorId());
        }

        String eventId = eventIdentifier(context.eventData());
        if (eventId != null) {
            for (RegisteredGenerator generator : registry.getByPriority(ContentPriority.NOTIFICATION)) {
                if (generator.registration().eventTriggerPattern() != null
                        && generator.registration().eventTriggerPattern().matcher(eventId).find()) {
                    return Optional.of(generator);
                }
            }
        }

        List<RegisteredGenerator> normal = registry.getByPriority(ContentPriority.NORMAL);
        if (!normal.isEmpty()) {
            return Optional.of(normal.get(random.nextInt(normal.size())));
        }

        return registry.getByPriority(ContentPriority.FALLBACK).stream().findFirst();
    }

    private static String eventIdentifier(Map<String, Object> eventData) {
        if (eventData == null || eventData.isEmpty()) {
            return null;
        }
        if (eventData.get("event_type") instanceof String eventType) {
            return eventType;
        }
        if (eventData.get("entity_id") instanceof String entityId) {
            return entityId;
        }
        return null;
    }
}
