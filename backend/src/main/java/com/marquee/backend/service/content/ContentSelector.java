package com.marquee.backend.service.content;

import com.marquee.backend.model.GenerationContext;

import java.util.Optional;

public interface ContentSelector {

    /**
     * The generator to run for this cycle, or empty when nothing is registered.
     */
    Optional<RegisteredGenerator> select(GenerationContext context);
}
