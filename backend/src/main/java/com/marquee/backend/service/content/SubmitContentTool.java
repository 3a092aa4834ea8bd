package com.marquee.backend.service.content;

import com.marquee.backend.model.ValidationResult;
import com.marquee.backend.service.ContentValidator;
import com.marquee.backend.service.ai.ToolDefinition;
import com.marquee.backend.util.CharacterConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The {@code submit_content} tool: validates a candidate message and explains rejections so the model can fix them.
 */
@Component
@RequiredArgsConstructor
public class SubmitContentTool {

    public static final String NAME = "submit_content";

    public static final ToolDefinition DEFINITION = new ToolDefinition(
            NAME,
            "Submit content for display on the board. Content must fit within the framed display area "
                    + "(5 rows x 21 characters). Use newlines to separate lines. Content is automatically "
                    + "converted to uppercase.",
            Map.of(
                    "type", "object",
                    "properties", Map.of("content", Map.of(
                            "type", "string",
                            "description", "The text content to display. Maximum 5 rows with 21 characters per "
                                    + "row. Use \\n for line breaks. Supported characters: A-Z, 0-9, space, and "
                                    + "common punctuation (.,:;!?'\"-()+=/). Content is uppercased automatically.")),
                    "required", List.of("content")));

    private final ContentValidator validator;

    public Result execute(String content) {
        String submitted = content == null ? "" : content;
        ValidationResult validation = validator.validateText(submitted);
        List<String> preview = renderPreview(submitted);
        if (validation.valid()) {
            return new Result(true, preview, List.of(), null);
        }
        return new Result(false, preview, actionableErrors(validation, submitted), hint(validation, submitted));
    }

    private List<String> actionableErrors(ValidationResult validation, String content) {
        List<String> errors = new ArrayList<>();
        if (content.isBlank()) {
            errors.add("Content cannot be empty. Please provide text to display.");
            return errors;
        }
        int rows = ContentValidator.CONTENT_ROWS;
        if (validation.lineCount() > rows) {
            int overBy = validation.lineCount() - rows;
            String plural = overBy > 1 ? "s" : "";
            errors.add(validation.wrappingApplied()
                    ? "Content has " + validation.lineCount() + " lines after word-wrapping (max " + rows
                    + "). Reduce by " + overBy + " line" + plural + " by shortening your text."
                    : "Content has " + validation.lineCount() + " lines (max " + rows + "). Remove "
                    + overBy + " line" + plural + ".");
        }
        if (!validation.invalidChars().isEmpty()) {
            List<String> shown = validation.invalidChars().subList(0, Math.min(5, validation.invalidChars().size()));
            int more = validation.invalidChars().size() - shown.size();
            errors.add("Invalid characters found: " + String.join(", ", shown)
                    + (more > 0 ? " (and " + more + " more)" : "")
                    + ". Use only A-Z, 0-9, space, and .,:;!?'\"-()+=/");
        }
        for (String error : validation.errors()) {
            if (error.contains("empty") || error.contains("lines") || error.contains("invalid characters")) {
                continue;
            }
            errors.add(error);
        }
        return errors;
    }

    private String hint(ValidationResult validation, String content) {
        if (content.isBlank()) {
            return "Provide motivational, informational, or creative content for the display.";
        }
        List<String> hints = new ArrayList<>();
        if (validation.lineCount() > ContentValidator.CONTENT_ROWS) {
            hints.add(validation.wrappingApplied()
                    ? "Your lines are too long and word-wrapping exceeded the row limit. "
                    + "Try using shorter phrases or fewer words per line."
                    : "The display can show " + ContentValidator.CONTENT_ROWS + " lines. "
                    + "Condense your message or split into multiple updates.");
        }
        if (!validation.invalidChars().isEmpty()) {
            hints.add("The board has a limited character set similar to airport departure boards. "
                    + "Stick to letters, numbers, and basic punctuation.");
        }
        if (validation.maxLineLength() > ContentValidator.CONTENT_COLS) {
            hints.add("Each line can have at most " + ContentValidator.CONTENT_COLS
                    + " characters. Use shorter words or abbreviations.");
        }
        if (hints.isEmpty()) {
            return "Review the preview to see how your content would appear and adjust accordingly.";
        }
        return String.join(" ", hints);
    }

    /**
     * Plain-text rendering of the submission against the content area, one entry per output line.
     */
    List<String> renderPreview(String content) {
        int maxCols = ContentValidator.CONTENT_COLS;
        int maxRows = ContentValidator.CONTENT_ROWS;
        List<String> output = new ArrayList<>();
        output.add("Preview (" + maxRows + "x" + maxCols + " content area):");
        output.add("");
        if (content.isBlank()) {
            return output;
        }
        String trimmed = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        String[] lines = trimmed.split("\n", -1);
        for (String line : lines) {
            int overflow = line.length() - maxCols;
            output.add(line + " |" + (overflow > 0 ? "ERR" : "ok") + " " + line.length() + " chars"
                    + (overflow > 0 ? " (+" + overflow + ")" : ""));
            if (overflow > 0) {
                List<String> wrapped = CharacterConverter.wrapText(line, maxCols);
                if (wrapped.size() > 1) {
                    output.add("  would wrap to:");
                    wrapped.forEach(part -> output.add("  - " + part));
                }
            }
        }
        if (lines.length > maxRows) {
            output.add("");
            output.add("ERROR: " + lines.length + " rows exceeds " + maxRows + " max rows");
        }
        return output;
    }

    public record Result(boolean accepted, List<String> preview, List<String> errors, String hint) {}
}
