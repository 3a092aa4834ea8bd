package com.marquee.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing scheduled task from killing its timer: the failure is logged and counted, never rethrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            log.error("Scheduled task failed task={}", taskName, e);
            metricsService.recordScheduledTaskFailure(taskName);
            return false;
        }
    }
}
