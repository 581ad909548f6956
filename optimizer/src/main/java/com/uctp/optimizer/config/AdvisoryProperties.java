package com.uctp.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "timetable.advisory")
public class AdvisoryProperties {
    private boolean enabled = false;
    private String apiKey;
    private String model = "gemini-2.5-flash";
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
    private Duration timeout = Duration.ofSeconds(15);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private int retries = 2;
    private Duration retryDelay = Duration.ofSeconds(2);
    private int minFeedbackSamples = 3;

    public boolean isConfigured() {
        return enabled && apiKey != null && !apiKey.isBlank();
    }
}
