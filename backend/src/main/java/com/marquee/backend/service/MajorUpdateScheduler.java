package com.marquee.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "marquee.scheduler.major.enabled", havingValue = "true")
public class MajorUpdateScheduler {

    private final MajorUpdateService majorUpdateService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${marquee.scheduler.major.cron:0 0 * * * *}")
    public void runCycle() {
        scheduledTaskGuard.run("major-update", () -> majorUpdateService.trigger(null, Map.of(), null, false));
    }
}
