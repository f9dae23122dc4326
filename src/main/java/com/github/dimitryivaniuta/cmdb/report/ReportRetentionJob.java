package com.github.dimitryivaniuta.cmdb.report;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes report executions whose retention_until has passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportRetentionJob {

    private final ReportService reports;

    @Scheduled(cron = "${cmdb.report.retention-cron:0 15 3 * * *}", zone = "UTC")
    public void purge() {
        int removed = reports.purgeExpiredExecutions();
        if (removed > 0) {
            log.info("Report retention removed {} expired executions", removed);
        }
    }
}
