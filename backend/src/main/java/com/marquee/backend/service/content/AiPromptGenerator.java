package com.marquee.backend.service.content;

import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.GeneratorValidationResult;
import com.marquee.backend.service.ai.AiGenerationRequest;
import com.marquee.backend.service.ai.AiGenerationResponse;
import com.marquee.backend.service.ai.AiProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prompt-template generator: one system and one user prompt, answered by the bound provider.
 * With {@code promptsOnly} set it returns the resolved prompts in its metadata without calling the provider.
 */
public class AiPromptGenerator implements ContentGenerator {

    public static final String SYSTEM_PROMPT_KEY = "systemPrompt";
    public static final String USER_PROMPT_KEY = "userPrompt";
    public static final String PROMPTS_ONLY_KEY = "promptsOnly";

    private final String generatorId;
    private final String modelTier;
    private final String systemPromptPath;
    private final String userPromptPath;
    private final PromptLoader promptLoader;
    private final AiProvider provider;

    public AiPromptGenerator(String generatorId, String modelTier, String systemPromptPath, String userPromptPath,
                             PromptLoader promptLoader, AiProvider provider) {
        this.generatorId = generatorId;
        this.modelTier = modelTier;
        this.systemPromptPath = systemPromptPath;
        this.userPromptPath = userPromptPath;
        this.promptLoader = promptLoader;
        this.provider = provider;
    }

    @Override
    public GeneratorValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (!promptLoader.exists(systemPromptPath)) {
            errors.add("System prompt not found: prompts/" + systemPromptPath);
        }
        if (!promptLoader.exists(userPromptPath)) {
            errors.add("User prompt not found: prompts/" + userPromptPath);
        }
        return errors.isEmpty() ? GeneratorValidationResult.ok() : new GeneratorValidationResult(false, errors);
    }

    @Override
    public GeneratedContent generate(GenerationContext context) {
        String systemPrompt = promptLoader.require(systemPromptPath);
        String userPrompt = formatUserPrompt(promptLoader.require(userPromptPath), context);

        if (context.promptsOnly()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("generatorId", generatorId);
            metadata.put("tier", modelTier);
            metadata.put(PROMPTS_ONLY_KEY, true);
            metadata.put(SYSTEM_PROMPT_KEY, systemPrompt);
            metadata.put(USER_PROMPT_KEY, userPrompt);
            return GeneratedContent.text("", metadata);
        }
        if (provider == null) {
            throw new IllegalStateException("No AI provider bound for generator " + generatorId);
        }

        AiGenerationResponse response = provider.generate(AiGenerationRequest.builder()
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .build());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generatorId", generatorId);
        metadata.put("provider", provider.getName());
        metadata.put("model", response.model());
        metadata.put("tier", modelTier);
        if (response.tokensUsed() != null) {
            metadata.put("tokensUsed", response.tokensUsed());
        }
        return GeneratedContent.text(response.text(), metadata);
    }

    private String formatUserPrompt(String template, GenerationContext context) {
        StringBuilder prompt = new StringBuilder(template);
        prompt.append("\n\nContext:\n");
        prompt.append("updateType: ").append(context.updateType()).append('\n');
        if (context.timestamp() != null) {
            prompt.append("timestamp: ").append(context.timestamp()).append('\n');
        }
        if (!context.eventData().isEmpty()) {
            new TreeMap<>(context.eventData()).forEach((key, value) ->
                    prompt.append("event.").append(key).append(": ").append(value).append('\n'));
        }
        if (context.contentData() != null && context.contentData().weather() != null) {
            prompt.append("weather: ").append(context.contentData().weather().temperature())
                    .append(context.contentData().weather().unit()).append('\n');
        }
        return prompt.toString().trim();
    }

    public String getGeneratorId() {
        return generatorId;
    }
}
