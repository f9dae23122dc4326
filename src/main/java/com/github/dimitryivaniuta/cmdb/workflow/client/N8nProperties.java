package com.github.dimitryivaniuta.cmdb.workflow.client;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Workflow engine connection settings, validated at startup.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cmdb.n8n")
public class N8nProperties {

    private boolean enabled = true;

    @NotBlank
    @Pattern(regexp = "^https?://[^\\s]+$", message = "base-url must be an http(s) URL")
    private String baseUrl = "http://localhost:5678";

    @NotBlank(message = "cmdb.n8n.api-key is required")
    @Size(min = 10, message = "api-key must be at least 10 characters")
    private String apiKey;

    @Min(1_000)
    @Max(300_000)
    private int timeoutMs = 30_000;

    @NotBlank
    private String userAgent = "NetworkCMDB-n8n-Client/1.0.0";

    private boolean loggingEnabled = false;

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Poll poll = new Poll();

    @Getter
    @Setter
    public static class RateLimit {
        @Min(1)
        @Max(1_000)
        private int maxRequestsPerMinute = 10;

        @Pattern(regexp = "^(memory|jdbc)$", message = "rate-limit.store must be memory or jdbc")
        private String store = "memory";
    }

    @Getter
    @Setter
    public static class Retry {
        @Min(1)
        @Max(10)
        private int maxAttempts = 3;

        @Min(100)
        @Max(10_000)
        private long baseDelayMs = 1_000;

        @Min(1_000)
        @Max(60_000)
        private long maxDelayMs = 30_000;

        private boolean exponentialBackoff = true;
    }

    @Getter
    @Setter
    public static class Poll {
        /** Pause between poll batches. */
        @Min(0)
        private long batchDelayMs = 1_000;
    }
}
