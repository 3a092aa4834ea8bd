package com.marquee.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.exception.AiProviderException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Messages API client with tool_use support.
 */
public class AnthropicProvider extends HttpAiProvider {

    public static final String NAME = "anthropic";

    private final MarqueeProperties.Provider settings;
    private final String apiVersion;

    public AnthropicProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                             MarqueeProperties.Provider settings, String apiVersion) {
        super(restTemplate, objectMapper);
        this.settings = settings;
        this.apiVersion = apiVersion;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public AiGenerationResponse generate(AiGenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : settings.getMaxTokens());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", buildMessages(request));
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (!request.tools().isEmpty()) {
            body.put("tools", request.tools().stream()
                    .map(tool -> Map.of(
                            "name", tool.name(),
                            "description", tool.description(),
                            "input_schema", tool.parameters()))
                    .toList());
        }

        JsonNode response = post(settings.getBaseUrl() + "/v1/messages",
                Map.of("x-api-key", settings.getApiKey(), "anthropic-version", apiVersion), body);

        JsonNode content = response.path("content");
        if (!content.isArray()) {
            throw new AiProviderException(NAME, "Invalid response from anthropic: no content");
        }
        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : content) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                toolCalls.add(new ToolCall(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        parseArguments(block.path("input"))));
            }
        }
        JsonNode usage = response.path("usage");
        Integer tokens = usage.isMissingNode()
                ? null
                : usage.path("input_tokens").asInt(0) + usage.path("output_tokens").asInt(0);
        return new AiGenerationResponse(
                text.toString(),
                response.path("model").asText(settings.getModel()),
                tokens,
                response.path("stop_reason").isTextual() ? response.path("stop_reason").asText() : null,
                toolCalls);
    }

    private List<Map<String, Object>> buildMessages(AiGenerationRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "user", "content", request.userPrompt() == null ? "" : request.userPrompt()));
        for (ToolExchange exchange : request.toolExchanges()) {
            ToolCall call = exchange.call();
            messages.add(Map.of("role", "assistant", "content", List.of(Map.of(
                    "type", "tool_use",
                    "id", call.id(),
                    "name", call.name(),
                    "input", call.arguments()))));
            ToolResult result = exchange.result();
            messages.add(Map.of("role", "user", "content", List.of(Map.of(
                    "type", "tool_result",
                    "tool_use_id", result.toolCallId(),
                    "content", result.content(),
                    "is_error", result.isError()))));
        }
        return messages;
    }
}
