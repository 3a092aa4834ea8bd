package com.marquee.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("Startup failed rootCause={}", root.getMessage(), exception);
        for (Throwable suppressed : root.getSuppressed()) {
            log.error("Startup failed suppressed={}", suppressed.getMessage(), suppressed);
        }
    }

    @Component
    @Slf4j
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final MarqueeProperties properties;

        public StartupReadyListener(MarqueeProperties properties) {
            this.properties = properties;
        }

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            log.info("Marquee ready display={} primaryProvider={} minorScheduler={} majorScheduler={}",
                    properties.getDisplay().getBaseUrl(),
                    properties.getProviders().getPrimary(),
                    properties.getScheduler().getMinor().isEnabled(),
                    properties.getScheduler().getMajor().isEnabled());
        }
    }

    static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
