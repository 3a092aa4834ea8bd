package com.marquee.backend.config;

import com.marquee.backend.model.ContentPriority;
import com.marquee.backend.model.FormatOptions;
import com.marquee.backend.service.content.ExhaustionStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "marquee")
@Data
@Validated
public class MarqueeProperties {

    @Valid
    private Circuit circuit = new Circuit();

    @Valid
    private Tool tool = new Tool();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Display display = new Display();

    @Valid
    private Providers providers = new Providers();

    @Valid
    private Content content = new Content();

    @Valid
    private Frame frame = new Frame();

    @Data
    public static class Circuit {
        // OFF provider circuits become eligible for a half-open probe after this long
        @NotNull
        private Duration resetTimeout = Duration.ofMinutes(5);

        @Min(1)
        private int halfOpenSuccessThreshold = 2;

        @Min(1)
        private int defaultFailureThreshold = 5;
    }

    @Data
    public static class Tool {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private ExhaustionStrategy exhaustionStrategy = ExhaustionStrategy.THROW;
    }

    @Data
    public static class Scheduler {
        private Minor minor = new Minor();
        private Major major = new Major();

        @Data
        public static class Minor {
            private boolean enabled = true;
        }

        @Data
        public static class Major {
            private boolean enabled = false;
            private String cron = "0 0 * * * *";
        }
    }

    @Data
    public static class Display {
        @NotBlank
        private String baseUrl = "http://vestaboard.local:7000";
        private String apiKey = "";
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 10000;
        private RateLimit rateLimit = new RateLimit();

        @Data
        public static class RateLimit {
            @Min(1)
            private int limitForPeriod = 1;
            @NotNull
            private Duration refreshPeriod = Duration.ofSeconds(1);
            @NotNull
            private Duration timeout = Duration.ofSeconds(5);
        }
    }

    @Data
    public static class Providers {
        // name of the preferred provider; the other configured provider is the alternate
        @NotBlank
        private String primary = "openai";
        @Min(1)
        private int connectTimeoutMs = 10000;
        @Min(1)
        private int readTimeoutMs = 60000;
        private Provider openai = new Provider("https://api.openai.com", "gpt-4.1-mini");
        private Provider anthropic = new Provider("https://api.anthropic.com", "claude-sonnet-4-5");
        private String anthropicVersion = "2023-06-01";
    }

    @Data
    public static class Provider {
        private String apiKey = "";
        private String baseUrl;
        private String model;
        @Min(1)
        private int maxTokens = 1024;

        public Provider() {
        }

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Content {
        // default for scheduled and API-triggered cycles
        private boolean toolBasedGeneration = true;
        private String fallbackLocation = "classpath*:fallback/*.txt";
        @Min(1)
        private int historyPageSize = 20;
        // upper bound for the history endpoint's limit parameter
        @Min(1)
        private int historyMaxPageSize = 200;
        @Valid
        private List<Generator> generators = new ArrayList<>();
    }

    @Data
    public static class Generator {
        @NotBlank
        private String id;
        @NotBlank
        private String name;
        @NotNull
        private ContentPriority priority = ContentPriority.NORMAL;
        private String modelTier = "light";
        @NotBlank
        private String systemPrompt;
        @NotBlank
        private String userPrompt;
        // NOTIFICATION generators only: regex matched against the trigger event type
        private String eventPattern;
        private FormatOptions.TextAlign textAlign = FormatOptions.TextAlign.CENTER;
        private boolean verticalCenter = true;
    }

    @Data
    public static class Frame {
        @NotBlank
        private String zone = "UTC";
        private List<Integer> colorBar = new ArrayList<>(List.of(63, 64, 65, 66, 67, 68));
    }
}
