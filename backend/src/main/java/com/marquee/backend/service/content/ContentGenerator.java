package com.marquee.backend.service.content;

import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.GeneratorValidationResult;

public interface ContentGenerator {

    GeneratedContent generate(GenerationContext context);

    /**
     * Static self-check (prompt files present, settings sane). Does not call any backend.
     */
    default GeneratorValidationResult validate() {
        return GeneratorValidationResult.ok();
    }
}
