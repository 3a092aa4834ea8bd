package com.marquee.backend.service.content;

import com.marquee.backend.service.ai.AiProvider;

/**
 * Builds a generator bound to one AI provider. Generators that need no provider ignore the argument,
 * which may be null.
 */
@FunctionalInterface
public interface GeneratorFactory {

    ContentGenerator create(AiProvider provider);
}
