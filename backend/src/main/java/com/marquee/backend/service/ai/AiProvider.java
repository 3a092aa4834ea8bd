package com.marquee.backend.service.ai;

/**
 * A chat-completion backend. Failures surface as {@link com.marquee.backend.exception.AiProviderException}
 * subclasses so callers can classify them.
 */
public interface AiProvider {

    /**
     * Lower-case provider name, e.g. {@code openai}. Also keys the provider's circuit.
     */
    String getName();

    AiGenerationResponse generate(AiGenerationRequest request);

    /**
     * False when the provider lacks credentials and should not be offered to the pipeline.
     */
    default boolean isConfigured() {
        return true;
    }
}
