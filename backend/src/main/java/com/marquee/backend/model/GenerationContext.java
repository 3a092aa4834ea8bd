package com.marquee.backend.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-cycle input to the content pipeline.
 *
 * @param generatorId            forces a specific registered generator when set
 * @param useToolBasedGeneration routes AI generators through the submit_content negotiation loop
 * @param promptsOnly            dry run: generators return their prompts without calling a provider
 * @param eventData              trigger payload for notification generators (may be empty)
 * @param contentData            weather and colour data for the frame decorator (may be null)
 */
@Builder(toBuilder = true)
public record GenerationContext(
        UpdateType updateType,
        Instant timestamp,
        String generatorId,
        boolean useToolBasedGeneration,
        boolean promptsOnly,
        Map<String, Object> eventData,
        ContentData contentData
) {

    public GenerationContext {
        eventData = eventData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
    }

    public static GenerationContext major(Instant timestamp) {
        return GenerationContext.builder().updateType(UpdateType.MAJOR).timestamp(timestamp).build();
    }

    public static GenerationContext minor(Instant timestamp) {
        return GenerationContext.builder().updateType(UpdateType.MINOR).timestamp(timestamp).build();
    }

    public boolean isMajor() {
        return updateType == UpdateType.MAJOR;
    }
}
