package com.marquee.backend.service.content;

import com.marquee.backend.model.CachedContent;
import com.marquee.backend.model.DisplayLayout;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.OutputMode;
import com.marquee.backend.service.ContentOrchestrator;
import com.marquee.backend.service.frame.FrameDecorator;
import com.marquee.backend.service.frame.FrameResult;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-decorates the cached major-update text with a fresh timestamp. Full-board layouts are left alone.
 */
@Component
public class MinorUpdateGenerator implements ContentGenerator {

    static final DateTimeFormatter UPDATED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ContentOrchestrator orchestrator;
    private final FrameDecorator frameDecorator;

    public MinorUpdateGenerator(ContentOrchestrator orchestrator, FrameDecorator frameDecorator) {
        this.orchestrator = orchestrator;
        this.frameDecorator = frameDecorator;
    }

    /**
     * True when there is nothing to refresh: no cache, or the cached content owns the whole board.
     */
    public boolean shouldSkip() {
        return orchestrator.getCachedContent()
                .map(content -> content.outputMode() == OutputMode.LAYOUT)
                .orElse(true);
    }

    @Override
    public GeneratedContent generate(GenerationContext context) {
        CachedContent cached = orchestrator.getCachedEntry()
                .orElseThrow(() -> new IllegalStateException("No cached content for minor update"));
        GeneratedContent content = cached.content();
        FrameResult frame = frameDecorator.decorate(content.text(), context.timestamp(),
                context.contentData() != null ? context.contentData() : cached.contentData(),
                cached.formatOptions());
        Map<String, Object> metadata = new LinkedHashMap<>(content.metadata());
        metadata.put("minorUpdate", true);
        metadata.put("updatedAt", UPDATED_AT.format(context.timestamp()));
        return GeneratedContent.layout(content.text(), DisplayLayout.ofCodes(frame.layout()), metadata);
    }
}
