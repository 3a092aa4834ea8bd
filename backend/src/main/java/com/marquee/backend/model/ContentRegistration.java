package com.marquee.backend.model;

import lombok.Builder;

import java.util.regex.Pattern;

@Builder
public record ContentRegistration(
        String id,
        String name,
        ContentPriority priority,
        String modelTier,
        Pattern eventTriggerPattern,
        FormatOptions formatOptions
) {

    public FormatOptions formatOptionsOrDefault() {
        return formatOptions != null ? formatOptions : FormatOptions.DEFAULT;
    }
}
