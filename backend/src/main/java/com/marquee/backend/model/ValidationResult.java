package com.marquee.backend.model;

import java.util.List;

/**
 * Outcome of structural validation. {@code normalizedText} is the wrapped, normalized text for TEXT content.
 */
public record ValidationResult(
        boolean valid,
        int lineCount,
        int maxLineLength,
        List<String> invalidChars,
        List<String> errors,
        boolean wrappingApplied,
        String normalizedText
) {

    public ValidationResult {
        invalidChars = invalidChars == null ? List.of() : List.copyOf(invalidChars);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
