package com.marquee.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit of output of the content pipeline. Metadata is an open provenance map
 * (provider, model, failover flags, tool-loop counters).
 */
public record GeneratedContent(
        String text,
        OutputMode outputMode,
        DisplayLayout layout,
        Map<String, Object> metadata
) {

    public GeneratedContent {
        text = text == null ? "" : text;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static GeneratedContent text(String text, Map<String, Object> metadata) {
        return new GeneratedContent(text, OutputMode.TEXT, null, metadata);
    }

    public static GeneratedContent layout(String text, DisplayLayout layout, Map<String, Object> metadata) {
        return new GeneratedContent(text, OutputMode.LAYOUT, layout, metadata);
    }

    public GeneratedContent withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        extra.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });
        return new GeneratedContent(text, outputMode, layout, merged);
    }

    public Object metadataValue(String key) {
        return metadata.get(key);
    }
}
