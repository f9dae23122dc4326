package com.github.dimitryivaniuta.cmdb.report;

/**
 * Stored as {@code scheduling_config}. The cron expression and zone are checked by
 * {@link ReportService} since they need Spring's parser.
 */
public record ScheduleConfig(
        boolean enabled,
        String cron,
        String timezone
) {
}
