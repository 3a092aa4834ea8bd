package com.marquee.backend.service.ai;

import lombok.Builder;

import java.util.List;

/**
 * @param toolExchanges earlier tool rounds of the same conversation, oldest first
 */
@Builder(toBuilder = true)
public record AiGenerationRequest(
        String systemPrompt,
        String userPrompt,
        Integer maxTokens,
        Double temperature,
        List<ToolDefinition> tools,
        List<ToolExchange> toolExchanges
) {

    public AiGenerationRequest {
        tools = tools == null ? List.of() : List.copyOf(tools);
        toolExchanges = toolExchanges == null ? List.of() : List.copyOf(toolExchanges);
    }
}
