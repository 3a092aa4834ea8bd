package com.marquee.backend.service.ai;

import java.util.Map;

/**
 * A tool offered to the model. {@code parameters} is a JSON Schema object.
 */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {}
