package com.marquee.backend.service.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.exception.ToolSubmissionExhaustedException;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.GeneratorValidationResult;
import com.marquee.backend.service.ContentValidator;
import com.marquee.backend.service.ai.AiGenerationRequest;
import com.marquee.backend.service.ai.AiGenerationResponse;
import com.marquee.backend.service.ai.AiProvider;
import com.marquee.backend.service.ai.ToolCall;
import com.marquee.backend.service.ai.ToolExchange;
import com.marquee.backend.service.ai.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a prompt generator through a bounded {@code submit_content} negotiation: the model submits, the tool
 * validates, rejections are fed back with the violations, until acceptance or the attempt budget runs out.
 * Turns are strictly sequential.
 */
@Slf4j
public class ToolBasedGenerator implements ContentGenerator {

    private final ContentGenerator baseGenerator;
    private final AiProvider provider;
    private final SubmitContentTool submitContentTool;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;
    private final ExhaustionStrategy exhaustionStrategy;

    public ToolBasedGenerator(ContentGenerator baseGenerator, AiProvider provider, SubmitContentTool submitContentTool,
                              ObjectMapper objectMapper, int maxAttempts, ExhaustionStrategy exhaustionStrategy) {
        this.baseGenerator = baseGenerator;
        this.provider = provider;
        this.submitContentTool = submitContentTool;
        this.objectMapper = objectMapper;
        this.maxAttempts = maxAttempts;
        this.exhaustionStrategy = exhaustionStrategy;
    }

    @Override
    public GeneratedContent generate(GenerationContext context) {
        GeneratedContent prompts = baseGenerator.generate(context.toBuilder().promptsOnly(true).build());
        if (context.promptsOnly()) {
            return prompts;
        }
        if (provider == null) {
            throw new IllegalStateException("No AI provider bound for tool-based generation");
        }
        String systemPrompt = stringValue(prompts.metadataValue(AiPromptGenerator.SYSTEM_PROMPT_KEY));
        String userPrompt = stringValue(prompts.metadataValue(AiPromptGenerator.USER_PROMPT_KEY));
        Map<String, Object> baseMetadata = new LinkedHashMap<>(prompts.metadata());
        baseMetadata.remove(AiPromptGenerator.SYSTEM_PROMPT_KEY);
        baseMetadata.remove(AiPromptGenerator.USER_PROMPT_KEY);
        baseMetadata.remove(AiPromptGenerator.PROMPTS_ONLY_KEY);
        baseMetadata.put("provider", provider.getName());

        List<ToolExchange> conversation = new ArrayList<>();
        int attempts = 0;
        String lastSubmission = null;
        SubmitContentTool.Result lastResult = null;

        while (attempts < maxAttempts) {
            AiGenerationResponse response = provider.generate(AiGenerationRequest.builder()
                    .systemPrompt(systemPrompt)
                    .userPrompt(userPrompt)
                    .tools(List.of(SubmitContentTool.DEFINITION))
                    .toolExchanges(conversation)
                    .build());

            if (!response.hasToolCalls()) {
                log.info("Tool loop accepted direct response provider={} attempts={}", provider.getName(), attempts);
                Map<String, Object> metadata = responseMetadata(baseMetadata, response);
                metadata.put("toolAttempts", 0);
                metadata.put("toolDirectResponse", true);
                return GeneratedContent.text(response.text() == null ? "" : response.text().toUpperCase(), metadata);
            }

            attempts++;
            ToolCall call = response.toolCalls().get(0);
            if (!SubmitContentTool.NAME.equals(call.name())) {
                log.warn("Tool loop received unknown tool name={} attempt={}", call.name(), attempts);
                conversation.add(new ToolExchange(call, new ToolResult(call.id(), toJson(Map.of(
                        "error", "Unknown tool: " + call.name() + ". Use submit_content to submit your content.")),
                        true)));
                continue;
            }

            Object rawContent = call.arguments().get("content");
            String submission = rawContent == null ? "" : rawContent.toString().toUpperCase();
            lastSubmission = submission;
            lastResult = submitContentTool.execute(submission);

            if (lastResult.accepted()) {
                Map<String, Object> metadata = responseMetadata(baseMetadata, response);
                metadata.put("toolAttempts", attempts);
                metadata.put("toolAccepted", true);
                return GeneratedContent.text(submission, metadata);
            }

            log.info("Tool loop rejected submission attempt={} errors={}", attempts, lastResult.errors());
            Map<String, Object> feedback = new LinkedHashMap<>();
            feedback.put("accepted", false);
            feedback.put("errors", lastResult.errors());
            feedback.put("hint", lastResult.hint());
            feedback.put("preview", lastResult.preview());
            conversation.add(new ToolExchange(call, new ToolResult(call.id(), toJson(feedback), false)));
        }

        return handleExhaustion(lastSubmission, lastResult, attempts, baseMetadata);
    }

    private GeneratedContent handleExhaustion(String lastSubmission, SubmitContentTool.Result lastResult,
                                              int attempts, Map<String, Object> baseMetadata) {
        if (exhaustionStrategy == ExhaustionStrategy.THROW) {
            String lastErrors = lastResult == null ? "unknown" : String.join(", ", lastResult.errors());
            throw new ToolSubmissionExhaustedException(attempts, "Last validation errors: " + lastErrors);
        }
        Map<String, Object> metadata = new LinkedHashMap<>(baseMetadata);
        metadata.put("toolAttempts", attempts);
        metadata.put("toolAccepted", false);
        metadata.put("toolExhausted", true);
        metadata.put("toolForceAccepted", true);
        return GeneratedContent.text(truncateToFit(lastSubmission == null ? "" : lastSubmission), metadata);
    }

    static String truncateToFit(String content) {
        return Arrays.stream(content.split("\n", -1))
                .limit(ContentValidator.CONTENT_ROWS)
                .map(line -> line.length() > ContentValidator.CONTENT_COLS
                        ? line.substring(0, ContentValidator.CONTENT_COLS)
                        : line)
                .collect(Collectors.joining("\n"));
    }

    private Map<String, Object> responseMetadata(Map<String, Object> baseMetadata, AiGenerationResponse response) {
        Map<String, Object> metadata = new LinkedHashMap<>(baseMetadata);
        metadata.put("model", response.model());
        if (response.tokensUsed() != null) {
            metadata.put("tokensUsed", response.tokensUsed());
        }
        return metadata;
    }

    @Override
    public GeneratorValidationResult validate() {
        return baseGenerator.validate();
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result serialization failed", e);
        }
    }

    private static String stringValue(Object value) {
        return value == null ? "" : value.toString();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public ExhaustionStrategy getExhaustionStrategy() {
        return exhaustionStrategy;
    }
}
