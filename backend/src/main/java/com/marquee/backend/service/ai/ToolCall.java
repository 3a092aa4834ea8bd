package com.marquee.backend.service.ai;

import java.util.Map;

public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
