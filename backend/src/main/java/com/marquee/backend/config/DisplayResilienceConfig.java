package com.marquee.backend.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DisplayResilienceConfig {

    @Bean
    public RateLimiter displayRateLimiter(MarqueeProperties properties) {
        MarqueeProperties.Display.RateLimit rateLimit = properties.getDisplay().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(rateLimit.getRefreshPeriod())
                .limitForPeriod(rateLimit.getLimitForPeriod())
                .timeoutDuration(rateLimit.getTimeout())
                .build();
        return RateLimiter.of("display", config);
    }
}
