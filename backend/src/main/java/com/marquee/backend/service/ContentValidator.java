package com.marquee.backend.service;

import com.marquee.backend.model.DisplayLayout;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.OutputMode;
import com.marquee.backend.model.ValidationResult;
import com.marquee.backend.util.CharacterConverter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on generator output. Never throws; failures are reported in the result.
 */
@Component
public class ContentValidator {

    public static final int CONTENT_ROWS = 5;
    public static final int CONTENT_COLS = 21;

    public ValidationResult validate(GeneratedContent content) {
        if (content == null) {
            return invalid("content is missing");
        }
        if (content.outputMode() == OutputMode.LAYOUT) {
            if (content.layout() == null) {
                return invalid("layout mode requires layout data");
            }
            return validateLayout(content.layout());
        }
        return validateText(content.text());
    }

    public ValidationResult validateText(String text) {
        if (text == null || text.isEmpty()) {
            return invalid("text content cannot be empty");
        }
        String normalized = CharacterConverter.normalize(text);
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        List<String> originalLines = List.of(normalized.split("\n", -1));
        boolean wrappingApplied = originalLines.stream().anyMatch(line -> line.length() > CONTENT_COLS);
        List<String> lines = new ArrayList<>();
        for (String line : originalLines) {
            if (line.length() > CONTENT_COLS) {
                lines.addAll(CharacterConverter.wrapText(line, CONTENT_COLS));
            } else {
                lines.add(line);
            }
        }

        List<String> errors = new ArrayList<>();
        if (lines.stream().allMatch(String::isBlank)) {
            errors.add("text content cannot be empty");
        }
        int lineCount = lines.size();
        if (lineCount > CONTENT_ROWS) {
            errors.add(wrappingApplied
                    ? "content exceeds " + CONTENT_ROWS + " lines after wrapping (found: " + lineCount + ")"
                    : "text mode content must have at most " + CONTENT_ROWS + " lines (found: " + lineCount + ")");
        }
        int maxLineLength = lines.stream().mapToInt(String::length).max().orElse(0);
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).length() > CONTENT_COLS) {
                errors.add("text mode line " + i + " exceeds " + CONTENT_COLS
                        + " characters (found: " + lines.get(i).length() + ")");
                break;
            }
        }
        List<String> invalidChars = findInvalidCharacters(String.join("", lines).toUpperCase());
        if (!invalidChars.isEmpty()) {
            errors.add("text contains invalid characters: " + String.join(", ", invalidChars));
        }
        return new ValidationResult(errors.isEmpty(), lineCount, maxLineLength, invalidChars, errors,
                wrappingApplied, String.join("\n", lines));
    }

    public ValidationResult validateLayout(DisplayLayout layout) {
        List<String> errors = new ArrayList<>();
        if (layout.hasCharacterCodes()) {
            int[][] codes = layout.characterCodes();
            int maxRowLength = 0;
            if (codes.length != CharacterConverter.ROWS) {
                errors.add("layout must have exactly " + CharacterConverter.ROWS + " rows (found: " + codes.length + ")");
            }
            for (int row = 0; row < codes.length; row++) {
                maxRowLength = Math.max(maxRowLength, codes[row].length);
                if (codes[row].length != CharacterConverter.COLS) {
                    errors.add("layout row " + row + " must have exactly " + CharacterConverter.COLS
                            + " columns (found: " + codes[row].length + ")");
                    break;
                }
            }
            outer:
            for (int row = 0; row < codes.length; row++) {
                for (int col = 0; col < codes[row].length; col++) {
                    int code = codes[row][col];
                    if (code < 0 || code > CharacterConverter.MAX_CODE) {
                        errors.add("Invalid character code " + code + " at row " + row + ", col " + col
                                + " (must be 0-" + CharacterConverter.MAX_CODE + ")");
                        break outer;
                    }
                }
            }
            return new ValidationResult(errors.isEmpty(), codes.length, maxRowLength, List.of(), errors, false, null);
        }

        List<String> rows = layout.rows().stream().map(CharacterConverter::normalize).toList();
        if (rows.size() != CharacterConverter.ROWS) {
            errors.add("layout must have exactly " + CharacterConverter.ROWS + " rows (found: " + rows.size() + ")");
        }
        int maxRowLength = rows.stream().mapToInt(String::length).max().orElse(0);
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).length() > CharacterConverter.COLS) {
                errors.add("layout row " + i + " exceeds " + CharacterConverter.COLS
                        + " characters (found: " + rows.get(i).length() + ")");
                break;
            }
        }
        List<String> invalidChars = findInvalidCharacters(String.join("", rows).toUpperCase());
        if (!invalidChars.isEmpty()) {
            errors.add("layout contains invalid characters: " + String.join(", ", invalidChars));
        }
        return new ValidationResult(errors.isEmpty(), rows.size(), maxRowLength, invalidChars, errors, false, null);
    }

    private static List<String> findInvalidCharacters(String text) {
        Set<String> invalid = new LinkedHashSet<>();
        text.codePoints().forEach(codePoint -> {
            if (Character.isBmpCodePoint(codePoint) && CharacterConverter.isSupported((char) codePoint)) {
                return;
            }
            invalid.add(new String(Character.toChars(codePoint)));
        });
        return new ArrayList<>(invalid);
    }

    private static ValidationResult invalid(String error) {
        return new ValidationResult(false, 0, 0, List.of(), List.of(error), false, null);
    }
}
