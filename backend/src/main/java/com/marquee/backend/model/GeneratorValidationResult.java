package com.marquee.backend.model;

import java.util.List;

public record GeneratorValidationResult(boolean valid, List<String> errors) {

    public GeneratorValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static GeneratorValidationResult ok() {
        return new GeneratorValidationResult(true, List.of());
    }

    public static GeneratorValidationResult invalid(String... errors) {
        return new GeneratorValidationResult(false, List.of(errors));
    }
}
