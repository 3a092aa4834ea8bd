package com.marquee.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate aiRestTemplate(MarqueeProperties properties) {
        MarqueeProperties.Providers providers = properties.getProviders();
        return restTemplate(providers.getConnectTimeoutMs(), providers.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate displayRestTemplate(MarqueeProperties properties) {
        MarqueeProperties.Display display = properties.getDisplay();
        return restTemplate(display.getConnectTimeoutMs(), display.getReadTimeoutMs());
    }

    private RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
