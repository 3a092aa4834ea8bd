package com.marquee.backend.service;

import com.marquee.backend.MutableClock;
import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.model.ContentData;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.model.UpdateType;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MajorUpdateServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private final ContentOrchestrator orchestrator = mock(ContentOrchestrator.class);
    private final CircuitBreakerService circuitBreakerService = mock(CircuitBreakerService.class);
    private final MarqueeProperties properties = new MarqueeProperties();
    private final MajorUpdateService service =
            new MajorUpdateService(orchestrator, circuitBreakerService, properties, new MutableClock(NOW));

    @Test
    void blockedUpdatesNeverReachThePipeline() {
        when(circuitBreakerService.isUpdateBlocked()).thenReturn(true);

        Optional<GeneratedContent> result = service.trigger(null, Map.of(), null, false);

        assertThat(result).isEmpty();
        verify(orchestrator, never()).generateAndSend(any());
    }

    @Test
    void buildsMajorContextFromRequest() {
        GeneratedContent sent = GeneratedContent.text("HI", Map.of());
        when(orchestrator.generateAndSend(any())).thenReturn(sent);
        ContentData data = new ContentData(new ContentData.Weather(18, "C", 66), List.of(63));

        Optional<GeneratedContent> result = service.trigger("door-notification",
                Map.of("event_type", "door.opened"), data, false);

        assertThat(result).contains(sent);
        ArgumentCaptor<GenerationContext> captor = ArgumentCaptor.forClass(GenerationContext.class);
        verify(orchestrator).generateAndSend(captor.capture());
        GenerationContext context = captor.getValue();
        assertThat(context.updateType()).isEqualTo(UpdateType.MAJOR);
        assertThat(context.timestamp()).isEqualTo(NOW);
        assertThat(context.generatorId()).isEqualTo("door-notification");
        assertThat(context.eventData()).containsEntry("event_type", "door.opened");
        assertThat(context.contentData()).isEqualTo(data);
        assertThat(context.useToolBasedGeneration()).isTrue();
        assertThat(context.promptsOnly()).isFalse();
    }

    @Test
    void dryRunIgnoresTheKillSwitches() {
        when(circuitBreakerService.isUpdateBlocked()).thenReturn(true);
        properties.getContent().setToolBasedGeneration(false);
        when(orchestrator.generateAndSend(any())).thenReturn(GeneratedContent.text("", Map.of()));

        assertThat(service.trigger(null, null, null, true)).isPresent();

        ArgumentCaptor<GenerationContext> captor = ArgumentCaptor.forClass(GenerationContext.class);
        verify(orchestrator).generateAndSend(captor.capture());
        assertThat(captor.getValue().promptsOnly()).isTrue();
        assertThat(captor.getValue().useToolBasedGeneration()).isFalse();
        assertThat(captor.getValue().eventData()).isEmpty();
    }
}
