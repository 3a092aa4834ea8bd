package com.marquee.backend.service;

import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.ContentHistory;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.repository.ContentHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Best-effort log of major-update outcomes. Persistence failures are logged and never reach the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentHistoryService {

    static final int MAX_TEXT_LENGTH = 2000;

    private final ContentHistoryRepository repository;
    private final MarqueeProperties properties;

    public void recordSuccess(GenerationContext context, GeneratedContent content, String generatorId,
                              String generatorName, Integer priority, Instant sentAt) {
        Map<String, Object> metadata = content.metadata();
        save(ContentHistory.builder()
                .text(truncate(content.text()))
                .updateType(context.updateType())
                .status(ContentHistory.Status.SUCCESS)
                .generatedAt(context.timestamp())
                .sentAt(sentAt)
                .generatorId(generatorId)
                .generatorName(generatorName)
                .priority(priority)
                .aiProvider(stringValue(metadata.get("provider")))
                .aiModel(stringValue(metadata.get("model")))
                .tokensUsed(metadata.get("tokensUsed") instanceof Number tokens ? tokens.intValue() : null)
                .failedOver(Boolean.TRUE.equals(metadata.get("failedOver")))
                .primaryProvider(stringValue(metadata.get("primaryProvider")))
                .build());
    }

    public void recordFailure(GenerationContext context, String generatorId, String generatorName, Throwable error) {
        save(ContentHistory.builder()
                .updateType(context.updateType())
                .status(ContentHistory.Status.FAILED)
                .generatedAt(context.timestamp())
                .generatorId(generatorId)
                .generatorName(generatorName)
                .errorType(error.getClass().getSimpleName())
                .errorMessage(truncate(error.getMessage()))
                .build());
    }

    public List<ContentHistory> recent(Integer limit) {
        MarqueeProperties.Content content = properties.getContent();
        int size = limit != null && limit > 0 ? limit : content.getHistoryPageSize();
        return repository.findAllByOrderByGeneratedAtDesc(
                PageRequest.of(0, Math.min(size, content.getHistoryMaxPageSize())));
    }

    private void save(ContentHistory entry) {
        try {
            repository.save(entry);
        } catch (RuntimeException e) {
            log.warn("Content history write failed status={} generatorId={}",
                    entry.getStatus(), entry.getGeneratorId(), e);
        }
    }

    static String truncate(String value) {
        return value != null && value.length() > MAX_TEXT_LENGTH ? value.substring(0, MAX_TEXT_LENGTH) : value;
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }
}
