package com.marquee.backend.model;

/**
 * Last major-update output kept for minor updates, with the formatting it was decorated with.
 */
public record CachedContent(
        GeneratedContent content,
        FormatOptions formatOptions,
        ContentData contentData,
        String generatorId
) {}
