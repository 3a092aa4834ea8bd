package com.marquee.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marqueeOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Marquee Display API")
                        .description("Content generation, circuit switches and history for the split-flap display")
                        .version("1.0"));
    }
}
