package com.guardian.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "advisor")
@Data
@Validated
public class AdvisorProperties {

    /**
     * {@code rules} for the built-in advisor, {@code http} for a remote one.
     */
    private String provider = "rules";

    private Http http = new Http();
    private Circuit circuit = new Circuit();

    @Positive
    private long debateTimeoutMs = 15000;

    @Data
    public static class Http {
        private String baseUrl = "http://localhost:8090";

        @Positive
        private int connectTimeoutMs = 5000;

        @Positive
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Circuit {
        @Positive
        private float failureRateThreshold = 50;

        @Positive
        private long waitOpenSeconds = 30;

        @Min(1)
        private int slidingWindowSize = 20;
    }
}
