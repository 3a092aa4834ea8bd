package com.marquee.backend.service.ai;

import java.util.List;

public record AiGenerationResponse(
        String text,
        String model,
        Integer tokensUsed,
        String finishReason,
        List<ToolCall> toolCalls
) {

    public AiGenerationResponse {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AiGenerationResponse text(String text, String model) {
        return new AiGenerationResponse(text, model, null, "stop", List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
