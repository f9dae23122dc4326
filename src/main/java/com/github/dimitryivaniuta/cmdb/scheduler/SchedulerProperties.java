package com.github.dimitryivaniuta.cmdb.scheduler;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Workflow polling schedule. Bare numbers in duration keys are minutes.
 * {@link PollingService#updateConfig} changes some of these at runtime.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cmdb.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;

    /** Six-field Spring cron expression. */
    @NotBlank
    private String schedule = "0 0 * * * *";

    @NotBlank
    private String timezone = "UTC";

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration maxDuration = Duration.ofMinutes(30);

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration lockTimeout = Duration.ofMinutes(35);

    @Min(1) @Max(10)
    private int retryAttempts = 3;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration retryDelay = Duration.ofMinutes(5);

    @Min(1) @Max(100)
    private int batchSize = 10;

    @Min(1) @Max(50)
    private int maxConcurrent = 5;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration healthCheckInterval = Duration.ofMinutes(30);

    @Valid
    private Lock lock = new Lock();

    @Getter
    @Setter
    public static class Lock {
        @Pattern(regexp = "^(memory|jdbc)$", message = "lock.store must be memory or jdbc")
        private String store = "jdbc";

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration cleanupInterval = Duration.ofMinutes(30);
    }
}
