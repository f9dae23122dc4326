package com.github.dimitryivaniuta.cmdb.report;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cmdb.report")
public class ReportProperties {

    /** Per-statement timeout when the caller does not pass one. */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration queryTimeout = Duration.ofSeconds(30);

    @Min(1) @Max(100_000)
    private int maxRows = 10_000;

    /** How long report executions are kept before the retention job deletes them. */
    @DurationUnit(ChronoUnit.DAYS)
    private Duration retention = Duration.ofDays(30);

    /** When {@link ReportRetentionJob} runs. */
    private String retentionCron = "0 15 3 * * *";

    /** Rows returned inline from {@code POST /api/reports/{id}/run}. */
    @Min(1) @Max(10_000)
    private int resultPreviewRows = 1_000;

    @Valid
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration defaultTtl = Duration.ofSeconds(600);

        @Min(1)
        private long maxEntries = 10_000;
    }
}
