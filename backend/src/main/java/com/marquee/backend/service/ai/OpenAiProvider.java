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
 * Chat Completions client with function-tool support.
 */
public class OpenAiProvider extends HttpAiProvider {

    public static final String NAME = "openai";

    private final MarqueeProperties.Provider settings;

    public OpenAiProvider(RestTemplate restTemplate, ObjectMapper objectMapper, MarqueeProperties.Provider settings) {
        super(restTemplate, objectMapper);
        this.settings = settings;
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
        body.put("messages", buildMessages(request));
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : settings.getMaxTokens());
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (!request.tools().isEmpty()) {
            body.put("tools", request.tools().stream().map(this::toFunctionTool).toList());
        }

        JsonNode response = post(settings.getBaseUrl() + "/v1/chat/completions",
                Map.of("Authorization", "Bearer " + settings.getApiKey()), body);

        JsonNode choice = response.path("choices").path(0);
        JsonNode message = choice.path("message");
        if (choice.isMissingNode() || message.isMissingNode()) {
            throw new AiProviderException(NAME, "Invalid response from openai: no choices");
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            if (!"function".equals(call.path("type").asText("function"))) {
                throw new AiProviderException(NAME, "Unsupported tool call type: " + call.path("type").asText());
            }
            toolCalls.add(new ToolCall(
                    call.path("id").asText(),
                    call.path("function").path("name").asText(),
                    parseArguments(call.path("function").path("arguments"))));
        }
        JsonNode usage = response.path("usage").path("total_tokens");
        return new AiGenerationResponse(
                message.path("content").isTextual() ? message.path("content").asText() : "",
                response.path("model").asText(settings.getModel()),
                usage.isNumber() ? usage.asInt() : null,
                choice.path("finish_reason").isTextual() ? choice.path("finish_reason").asText() : null,
                toolCalls);
    }

    private List<Map<String, Object>> buildMessages(AiGenerationRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", nullToEmpty(request.systemPrompt())));
        messages.add(Map.of("role", "user", "content", nullToEmpty(request.userPrompt())));
        for (ToolExchange exchange : request.toolExchanges()) {
            ToolCall call = exchange.call();
            Map<String, Object> assistant = new LinkedHashMap<>();
            assistant.put("role", "assistant");
            assistant.put("content", null);
            assistant.put("tool_calls", List.of(Map.of(
                    "id", call.id(),
                    "type", "function",
                    "function", Map.of("name", call.name(), "arguments", toJson(call.arguments())))));
            messages.add(assistant);
            messages.add(Map.of(
                    "role", "tool",
                    "tool_call_id", exchange.result().toolCallId(),
                    "content", exchange.result().content()));
        }
        return messages;
    }

    private Map<String, Object> toFunctionTool(ToolDefinition tool) {
        return Map.of("type", "function", "function", Map.of(
                "name", tool.name(),
                "description", tool.description(),
                "parameters", tool.parameters()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
