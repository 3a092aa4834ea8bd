package com.marquee.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marquee.backend.service.ai.AnthropicProvider;
import com.marquee.backend.service.ai.OpenAiProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AiProviderConfig {

    @Bean
    public OpenAiProvider openAiProvider(@Qualifier("aiRestTemplate") RestTemplate aiRestTemplate,
                                         ObjectMapper objectMapper,
                                         MarqueeProperties properties) {
        return new OpenAiProvider(aiRestTemplate, objectMapper, properties.getProviders().getOpenai());
    }

    @Bean
    public AnthropicProvider anthropicProvider(@Qualifier("aiRestTemplate") RestTemplate aiRestTemplate,
                                               ObjectMapper objectMapper,
                                               MarqueeProperties properties) {
        MarqueeProperties.Providers providers = properties.getProviders();
        return new AnthropicProvider(aiRestTemplate, objectMapper, providers.getAnthropic(),
                providers.getAnthropicVersion());
    }
}
