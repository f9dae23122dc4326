package com.github.dimitryivaniuta.cmdb.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cmdb.api")
public class ApiProperties {

    @Valid
    private TriggerRateLimit triggerRateLimit = new TriggerRateLimit();

    @Getter
    @Setter
    public static class TriggerRateLimit {
        private boolean enabled = true;

        /** Workflow triggers allowed per caller (user id, else client IP) per minute. */
        @Min(1) @Max(10_000)
        private int permitsPerMinute = 10;

        /** Upper bound on distinct callers tracked at once. */
        @Min(100)
        private long maxTrackedClients = 10_000;
    }
}
