package com.marquee.backend.controller;

import com.marquee.backend.dto.ContentResponse;
import com.marquee.backend.dto.GenerateContentRequest;
import com.marquee.backend.exception.NotFoundException;
import com.marquee.backend.model.ContentHistory;
import com.marquee.backend.service.ContentHistoryService;
import com.marquee.backend.service.ContentOrchestrator;
import com.marquee.backend.service.MajorUpdateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
@Tag(name = "Content")
public class ContentController {

    private final MajorUpdateService majorUpdateService;
    private final ContentOrchestrator orchestrator;
    private final ContentHistoryService contentHistoryService;

    @PostMapping("/generate")
    @Operation(summary = "Run a major update now")
    public ResponseEntity<ContentResponse> generate(@RequestBody(required = false) GenerateContentRequest request) {
        GenerateContentRequest effective = request != null ? request : GenerateContentRequest.empty();
        log.info("Manual major update requested generatorId={} promptsOnly={}",
                effective.generatorId(), effective.isPromptsOnly());
        return majorUpdateService.trigger(effective.generatorId(), effective.eventData(),
                        effective.contentData(), effective.isPromptsOnly())
                .map(content -> ResponseEntity.ok(ContentResponse.of(
                        effective.isPromptsOnly() ? ContentResponse.PREVIEW : ContentResponse.SENT, content)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(ContentResponse.skipped()));
    }

    @GetMapping("/latest")
    @Operation(summary = "Content currently cached for minor updates")
    public ResponseEntity<ContentResponse> latest() {
        return orchestrator.getCachedContent()
                .map(content -> ResponseEntity.ok(ContentResponse.of(ContentResponse.CACHED, content)))
                .orElseThrow(() -> new NotFoundException("No content has been sent yet"));
    }

    @GetMapping("/history")
    @Operation(summary = "Recent major-update outcomes, newest first")
    public ResponseEntity<List<ContentHistory>> history(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(contentHistoryService.recent(limit));
    }
}
