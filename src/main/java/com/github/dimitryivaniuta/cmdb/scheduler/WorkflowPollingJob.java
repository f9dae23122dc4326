package com.github.dimitryivaniuta.cmdb.scheduler;

import com.github.dimitryivaniuta.cmdb.workflow.N8nWorkflowService;
import com.github.dimitryivaniuta.cmdb.workflow.PollingOptions;
import com.github.dimitryivaniuta.cmdb.workflow.PollingResult;
import com.github.dimitryivaniuta.cmdb.workflow.WorkflowRegistryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One polling pass over the workflow registry. Overlapping calls in this process are skipped;
 * cross-instance exclusion is the job lock's business.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowPollingJob {

    public static final String JOB_NAME = "WorkflowPollingJob";

    private final N8nWorkflowService workflows;
    private final WorkflowRegistryRepository registry;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant lastRunTime;
    private volatile PollingResult lastRunResult;

    public JobRunResult execute(PollingOptions options) {
        Instant start = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.warn("{} already running - skipping execution", JOB_NAME);
            return new JobRunResult(JOB_NAME, start, clock.instant(), false,
                    "Job already running - skipping execution", 0, null);
        }
        lastRunTime = start;
        try {
            log.info("{} started options={}", JOB_NAME, options);
            PollingResult result = workflows.pollWorkflowStatuses(options);
            lastRunResult = result;
            Instant end = clock.instant();
            return new JobRunResult(JOB_NAME, start, end, true, null, Duration.between(start, end).toMillis(), result);
        } catch (RuntimeException ex) {
            Instant end = clock.instant();
            log.error("{} failed after {}ms", JOB_NAME, Duration.between(start, end).toMillis(), ex);
            return new JobRunResult(JOB_NAME, start, end, false, ex.getMessage(),
                    Duration.between(start, end).toMillis(), null);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public JobStatus getStatus() {
        return new JobStatus(running.get(), lastRunTime, lastRunResult);
    }

    public JobHealth healthCheck() {
        boolean n8n = workflows.healthCheck();
        boolean database;
        try {
            registry.count();
            database = true;
        } catch (DataAccessException ex) {
            log.warn("{} health: database check failed: {}", JOB_NAME, ex.getMessage());
            database = false;
        }
        PollingResult last = lastRunResult;
        LastRun lastRun = lastRunTime == null || last == null
                ? null
                : new LastRun(lastRunTime, !last.hasErrors(), last.durationMs());
        return new JobHealth(n8n && database, n8n, database, lastRun);
    }

    public record JobStatus(boolean running, Instant lastRunTime, PollingResult lastRunResult) {
    }

    public record JobHealth(boolean healthy, boolean n8n, boolean database, LastRun lastRun) {
    }

    public record LastRun(Instant time, boolean success, long durationMs) {
    }
}
