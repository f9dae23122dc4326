package com.github.dimitryivaniuta.cmdb.outbox;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cmdb.outbox")
public class OutboxProperties {

    @Min(1) @Max(1000)
    private int batchSize = 50;

    @Min(1) @Max(50)
    private int maxAttempts = 8;

    private Duration baseBackoff = Duration.ofSeconds(5);
    private Duration maxBackoff = Duration.ofMinutes(10);
    private Duration lease = Duration.ofMinutes(1);
    private long pollIntervalMs = 5_000;
    private Duration processedRetention = Duration.ofDays(7);
}
