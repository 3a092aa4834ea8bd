package com.marquee.backend.dto;

import com.marquee.backend.model.ContentData;

import java.util.Map;

/**
 * Manual major-update trigger. Every field is optional.
 *
 * @param generatorId    forces a registered generator instead of priority selection
 * @param promptsOnly    returns the resolved prompts without calling a provider or the display
 * @param eventData      trigger payload; {@code event_type} or {@code entity_id} select notification generators
 */
public record GenerateContentRequest(
        String generatorId,
        Boolean promptsOnly,
        Map<String, Object> eventData,
        ContentData contentData
) {

    public static GenerateContentRequest empty() {
        return new GenerateContentRequest(null, false, Map.of(), null);
    }

    public boolean isPromptsOnly() {
        return Boolean.TRUE.equals(promptsOnly);
    }
}
