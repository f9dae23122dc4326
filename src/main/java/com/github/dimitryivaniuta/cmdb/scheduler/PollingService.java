package com.github.dimitryivaniuta.cmdb.scheduler;

import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.workflow.PollingOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs {@link WorkflowPollingJob} on a cron trigger under the {@value #LOCK_NAME} job lock.
 * <p>
 * A run that cannot get the lock is skipped. A failed run is retried up to
 * {@code retry-attempts} times with {@code retry-delay} between attempts. Manual runs go through
 * the same lock and are rejected while another run is active.
 */
@Slf4j
@Service
public class PollingService implements SmartLifecycle {

    public static final String LOCK_NAME = "workflow-polling";

    private final TaskScheduler scheduler;
    private final WorkflowPollingJob job;
    private final JobLock lock;
    private final SchedulerProperties props;
    private final CmdbMetrics metrics;
    private final Clock clock;

    private final Object scheduleMonitor = new Object();
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong successfulRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();

    private volatile boolean lifecycleRunning;
    private volatile ScheduledFuture<?> pollFuture;
    private volatile ScheduledFuture<?> healthFuture;
    private volatile Instant lastRunTime;
    private volatile JobRunResult lastRunResult;
    private volatile int currentRetryAttempt;

    public PollingService(TaskScheduler scheduler,
                          WorkflowPollingJob job,
                          JobLock lock,
                          SchedulerProperties props,
                          CmdbMetrics metrics,
                          Clock clock) {
        this.scheduler = scheduler;
        this.job = job;
        this.lock = lock;
        this.props = props;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        synchronized (scheduleMonitor) {
            lifecycleRunning = true;
            if (!props.isEnabled()) {
                log.info("Workflow polling scheduler is disabled");
                return;
            }
            schedule();
            healthFuture = scheduler.scheduleAtFixedRate(this::logHealth, props.getHealthCheckInterval());
        }
    }

    /**
     * Cancels the trigger, then waits up to {@code max-duration} for a running poll to finish.
     * The running poll is not interrupted.
     */
    @Override
    public void stop() {
        synchronized (scheduleMonitor) {
            cancelScheduled();
            if (healthFuture != null) {
                healthFuture.cancel(false);
                healthFuture = null;
            }
            lifecycleRunning = false;
        }
        long deadline = System.nanoTime() + props.getMaxDuration().toNanos();
        while (executing.get() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (executing.get()) {
            log.warn("Workflow poll still running after {}; shutting down without waiting further", props.getMaxDuration());
        } else {
            log.info("Workflow polling scheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return lifecycleRunning;
    }

    // ---------------------------------------------------------------- runs

    /**
     * Scheduled entry point.
     *
     * @return the run result, empty when the run was skipped because the lock is held
     */
    public Optional<JobRunResult> executePoll() {
        return runLocked(PollingOptions.defaults(), false);
    }

    /**
     * @throws PollingInProgressException when a run is active here or the lock is held elsewhere
     */
    public JobRunResult executeManual(PollingOptions options) {
        if (executing.get() || job.isRunning()) {
            throw new PollingInProgressException("A workflow poll is already in progress");
        }
        return runLocked(options == null ? PollingOptions.defaults() : options, true)
                .orElseThrow(() -> new PollingInProgressException("A workflow poll holds the polling lock"));
    }

    private Optional<JobRunResult> runLocked(PollingOptions options, boolean manual) {
        if (!lock.acquireLock(LOCK_NAME, props.getLockTimeout())) {
            log.warn("Workflow poll skipped: lock {} is held", LOCK_NAME);
            metrics.pollingRun("skipped");
            return Optional.empty();
        }
        executing.set(true);
        try {
            lastRunTime = clock.instant();
            log.info("Workflow poll starting ({})", manual ? "manual" : "scheduled");
            JobRunResult result = executeWithRetry(options);
            lastRunResult = result;
            totalRuns.incrementAndGet();
            if (result.success()) {
                successfulRuns.incrementAndGet();
                metrics.pollingRun("success");
            } else {
                failedRuns.incrementAndGet();
                metrics.pollingRun("failure");
            }
            return Optional.of(result);
        } finally {
            currentRetryAttempt = 0;
            executing.set(false);
            lock.releaseLock(LOCK_NAME);
        }
    }

    private JobRunResult executeWithRetry(PollingOptions options) {
        int attempts = Math.max(1, props.getRetryAttempts());
        JobRunResult result = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            currentRetryAttempt = attempt;
            result = job.execute(options);
            if (result.success()) {
                return result;
            }
            if (attempt < attempts) {
                Duration delay = props.getRetryDelay();
                log.warn("Workflow poll attempt {}/{} failed ({}), retrying in {}", attempt, attempts, result.error(), delay);
                if (!pause(delay)) {
                    break;
                }
            }
        }
        log.error("Workflow poll failed after {} attempts: {}", attempts, result.error());
        return result;
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ---------------------------------------------------------------- configuration

    public PollingStatus updateConfig(PollingConfigUpdate update) {
        List<ErrorDetail> errors = new ArrayList<>();
        if (update.schedule() != null && !CronExpression.isValidExpression(update.schedule())) {
            errors.add(new ErrorDetail(ValidationFailedException.CODE, "Invalid cron expression: " + update.schedule(), "schedule"));
        }
        if (update.timezone() != null) {
            try {
                ZoneId.of(update.timezone());
            } catch (DateTimeException ex) {
                errors.add(new ErrorDetail(ValidationFailedException.CODE, "Invalid timezone: " + update.timezone(), "timezone"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationFailedException(errors);
        }

        synchronized (scheduleMonitor) {
            if (update.enabled() != null) props.setEnabled(update.enabled());
            if (update.schedule() != null) props.setSchedule(update.schedule());
            if (update.timezone() != null) props.setTimezone(update.timezone());
            if (update.retryAttempts() != null) props.setRetryAttempts(update.retryAttempts());
            if (update.retryDelayMinutes() != null) props.setRetryDelay(Duration.ofMinutes(update.retryDelayMinutes()));
            if (update.batchSize() != null) props.setBatchSize(update.batchSize());
            if (update.maxConcurrent() != null) props.setMaxConcurrent(update.maxConcurrent());

            cancelScheduled();
            if (lifecycleRunning && props.isEnabled()) {
                schedule();
            }
        }
        log.info("Workflow polling reconfigured: enabled={} schedule='{}' timezone={}",
                props.isEnabled(), props.getSchedule(), props.getTimezone());
        return getStatus();
    }

    // ---------------------------------------------------------------- status

    public PollingStatus getStatus() {
        boolean scheduled = pollFuture != null;
        return new PollingStatus(
                executing.get(),
                scheduled,
                scheduled ? nextRunTime() : null,
                lastRunTime,
                lastRunResult,
                totalRuns.get(),
                successfulRuns.get(),
                failedRuns.get(),
                currentRetryAttempt,
                props.getSchedule(),
                props.getTimezone());
    }

    public PollingHealth getHealth() {
        WorkflowPollingJob.JobHealth jobHealth = job.healthCheck();
        PollingStatus status = getStatus();
        String state;
        if (!jobHealth.healthy()) {
            state = "unhealthy";
        } else if (status.lastRunResult() != null && !status.lastRunResult().success()) {
            state = "degraded";
        } else {
            state = "healthy";
        }
        return new PollingHealth(state, lifecycleRunning, jobHealth, status);
    }

    private Instant nextRunTime() {
        ZoneId zone = ZoneId.of(props.getTimezone());
        ZonedDateTime next = CronExpression.parse(props.getSchedule()).next(ZonedDateTime.now(clock.withZone(zone)));
        return next == null ? null : next.toInstant();
    }

    private void schedule() {
        CronTrigger trigger = new CronTrigger(props.getSchedule(), ZoneId.of(props.getTimezone()));
        pollFuture = scheduler.schedule(this::executePoll, trigger);
        log.info("Workflow polling scheduled with '{}' ({}), next run {}", props.getSchedule(), props.getTimezone(), nextRunTime());
    }

    private void cancelScheduled() {
        ScheduledFuture<?> f = pollFuture;
        if (f != null) {
            f.cancel(false);
            pollFuture = null;
        }
    }

    private void logHealth() {
        PollingHealth health = getHealth();
        if (health.isHealthy()) {
            log.debug("Workflow polling health: {}", health.status());
        } else {
            log.warn("Workflow polling health: {} (n8n={}, database={})",
                    health.status(), health.job().n8n(), health.job().database());
        }
    }
}
