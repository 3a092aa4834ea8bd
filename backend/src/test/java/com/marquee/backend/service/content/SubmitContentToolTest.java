package com.marquee.backend.service.content;

import com.marquee.backend.service.ContentValidator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubmitContentToolTest {

    private final SubmitContentTool tool = new SubmitContentTool(new ContentValidator());

    @Test
    void validContentIsAcceptedWithPreview() {
        SubmitContentTool.Result result = tool.execute("GOOD MORNING\nSUNSHINE");

        assertThat(result.accepted()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.hint()).isNull();
        assertThat(result.preview()).contains("GOOD MORNING |ok 12 chars", "SUNSHINE |ok 8 chars");
    }

    @Test
    void blankContentGetsEmptyGuidance() {
        SubmitContentTool.Result result = tool.execute("   ");

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors()).containsExactly("Content cannot be empty. Please provide text to display.");
        assertThat(result.hint()).startsWith("Provide motivational");
    }

    @Test
    void tooManyLinesSaysHowManyToRemove() {
        SubmitContentTool.Result result = tool.execute("A\nB\nC\nD\nE\nF\nG");

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors()).containsExactly("Content has 7 lines (max 5). Remove 2 lines.");
        assertThat(result.hint()).contains("The display can show 5 lines");
        assertThat(result.preview()).contains("ERROR: 7 rows exceeds 5 max rows");
    }

    @Test
    void wrappedOverflowPointsAtLineLength() {
        String text = "THIS FIRST LINE IS FAR TOO LONG FOR THE BOARD\nSECOND\nTHIRD\nFOURTH";

        SubmitContentTool.Result result = tool.execute(text);

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors().get(0)).startsWith("Content has 6 lines after word-wrapping (max 5)");
        assertThat(result.hint()).contains("word-wrapping exceeded the row limit");
        assertThat(result.preview()).anySatisfy(line -> assertThat(line).contains("|ERR 45 chars (+24)"));
        assertThat(result.preview()).contains("  would wrap to:");
    }

    @Test
    void invalidCharactersAreListed() {
        SubmitContentTool.Result result = tool.execute("PRICE ~ 5 EUROS ^");

        assertThat(result.accepted()).isFalse();
        assertThat(result.errors()).singleElement().asString()
                .startsWith("Invalid characters found: ~, ^.");
        assertThat(result.hint()).contains("limited character set");
    }
}
