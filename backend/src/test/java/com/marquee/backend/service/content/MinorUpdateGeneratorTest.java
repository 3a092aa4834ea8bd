package com.marquee.backend.service.content;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.CachedContent;
import com.marquee.backend.model.ContentData;
import com.marquee.backend.model.DisplayLayout;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.OutputMode;
import com.marquee.backend.service.ContentOrchestrator;
import com.marquee.backend.service.frame.InfoBarFrameDecorator;
import com.marquee.backend.util.CharacterConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MinorUpdateGeneratorTest {

    private ContentOrchestrator orchestrator;
    private MinorUpdateGenerator generator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ContentOrchestrator.class);
        generator = new MinorUpdateGenerator(orchestrator, new InfoBarFrameDecorator(new MarqueeProperties()));
    }

    @Test
    void skipsWithoutCacheOrForFullLayouts() {
        when(orchestrator.getCachedContent()).thenReturn(Optional.empty());
        assertThat(generator.shouldSkip()).isTrue();

        GeneratedContent layout = GeneratedContent.layout("", DisplayLayout.ofCodes(new int[6][22]), Map.of());
        when(orchestrator.getCachedContent()).thenReturn(Optional.of(layout));
        assertThat(generator.shouldSkip()).isTrue();

        when(orchestrator.getCachedContent()).thenReturn(Optional.of(GeneratedContent.text("HI", Map.of())));
        assertThat(generator.shouldSkip()).isFalse();
    }

    @Test
    void redecoratesCachedTextWithTheNewTime() {
        GeneratedContent cached = GeneratedContent.text("GOOD MORNING", Map.of("generatorId", "haiku"));
        ContentData data = new ContentData(null, List.of(63, 63, 63, 63, 63, 63));
        when(orchestrator.getCachedEntry())
                .thenReturn(Optional.of(new CachedContent(cached, FormatOptions.DEFAULT, data, "haiku")));

        GeneratedContent minor = generator.generate(
                GenerationContext.minor(Instant.parse("2024-03-15T10:01:00Z")));

        assertThat(minor.text()).isEqualTo("GOOD MORNING");
        assertThat(minor.outputMode()).isEqualTo(OutputMode.LAYOUT);
        assertThat(minor.metadata())
                .containsEntry("generatorId", "haiku")
                .containsEntry("minorUpdate", true)
                .containsEntry("updatedAt", "2024-03-15T10:01:00.000Z");
        int[][] codes = minor.layout().characterCodes();
        assertThat(CharacterConverter.layoutToText(new int[][]{Arrays.copyOf(codes[5], 21)}))
                .isEqualTo("FRI 15MAR 10:01");
        assertThat(codes[0][21]).isEqualTo(63);
    }

    @Test
    void generateWithoutCacheFails() {
        when(orchestrator.getCachedEntry()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> generator.generate(GenerationContext.minor(Instant.now())))
                .isInstanceOf(IllegalStateException.class);
    }
}
