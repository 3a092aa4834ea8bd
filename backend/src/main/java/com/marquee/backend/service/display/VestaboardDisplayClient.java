package com.marquee.backend.service.display;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.config.MarqueeProperties;
import com.marquee.backend.exception.DisplayClientException;
import com.marquee.backend.service.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * Local-API client for the board. Sends go through the rate limiter because the device drops bursts.
 */
@Slf4j
@Service
public class VestaboardDisplayClient implements DisplayClient {

    static final String API_KEY_HEADER = "X-Vestaboard-Local-Api-Key";
    static final String MESSAGE_PATH = "/local-api/message";

    private final RestTemplate displayRestTemplate;
    private final RateLimiter displayRateLimiter;
    private final ObjectMapper objectMapper;
    private final MarqueeProperties properties;
    private final MetricsService metricsService;

    public VestaboardDisplayClient(@Qualifier("displayRestTemplate") RestTemplate displayRestTemplate,
                                   RateLimiter displayRateLimiter,
                                   ObjectMapper objectMapper,
                                   MarqueeProperties properties,
                                   MetricsService metricsService) {
        this.displayRestTemplate = displayRestTemplate;
        this.displayRateLimiter = displayRateLimiter;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    @Override
    public void sendLayout(int[][] layout) {
        Supplier<Void> send = () -> {
            post(layout);
            return null;
        };
        try {
            RateLimiter.decorateSupplier(displayRateLimiter, send).get();
            metricsService.recordDisplaySend(true);
        } catch (RequestNotPermitted e) {
            metricsService.recordDisplaySend(false);
            throw new DisplayClientException("Display rate limit exceeded", 429, e);
        } catch (DisplayClientException e) {
            metricsService.recordDisplaySend(false);
            throw e;
        }
    }

    private void post(int[][] layout) {
        String url = properties.getDisplay().getBaseUrl() + MESSAGE_PATH;
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, properties.getDisplay().getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String body = objectMapper.writeValueAsString(layout);
            displayRestTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Display send failed status={}", status);
            String reason = switch (status) {
                case 401, 403 -> "Display authentication failed";
                case 429 -> "Display rate limit exceeded";
                default -> status >= 500 ? "Display server error" : "Display request rejected";
            };
            throw new DisplayClientException(reason + " (" + status + ")", status, e);
        } catch (ResourceAccessException e) {
            log.warn("Display unreachable message={}", e.getMessage());
            throw new DisplayClientException("Display unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new DisplayClientException("Layout serialization failed", e);
        }
    }
}
