package com.marquee.backend.dto;

import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.OutputMode;
import com.marquee.backend.util.CharacterConverter;
import lombok.Builder;

import java.util.Map;

@Builder
public record ContentResponse(
        String status,
        String text,
        OutputMode outputMode,
        String board,
        Map<String, Object> metadata
) {

    public static final String SENT = "SENT";
    public static final String PREVIEW = "PREVIEW";
    public static final String CACHED = "CACHED";
    public static final String SKIPPED = "SKIPPED";

    public static ContentResponse of(String status, GeneratedContent content) {
        String board = content.layout() != null && content.layout().hasCharacterCodes()
                ? CharacterConverter.layoutToText(content.layout().characterCodes())
                : null;
        return ContentResponse.builder()
                .status(status)
                .text(content.text())
                .outputMode(content.outputMode())
                .board(board)
                .metadata(content.metadata())
                .build();
    }

    public static ContentResponse skipped() {
        return ContentResponse.builder()
                .status(SKIPPED)
                .metadata(Map.of("reason", "updates blocked by MASTER or SLEEP_MODE"))
                .build();
    }
}
