package com.github.dimitryivaniuta.cmdb.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class CmdbMetrics {

    private final MeterRegistry registry;

    public CmdbMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- n8n client ----
    public void n8nRequest(String method, int status) {
        Counter.builder("cmdb_n8n_requests_total")
                .tag("method", method)
                .tag("status", String.valueOf(status)) // 0 = no response
                .register(registry)
                .increment();
    }

    public void n8nRetry(String errorCode) {
        Counter.builder("cmdb_n8n_retries_total")
                .tag("code", errorCode)
                .register(registry)
                .increment();
    }

    public void n8nRateLimitWait() {
        Counter.builder("cmdb_n8n_ratelimit_waits_total")
                .register(registry)
                .increment();
    }

    // ---- Inbound throttling ----
    public void triggerRejected() {
        Counter.builder("cmdb_workflow_trigger_rejected_total")
                .register(registry)
                .increment();
    }

    // ---- Report cache ----
    public void cacheHit(String queryName) {
        Counter.builder("cmdb_report_cache_hits_total")
                .tag("query", queryName)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String queryName) {
        Counter.builder("cmdb_report_cache_misses_total")
                .tag("query", queryName)
                .register(registry)
                .increment();
    }

    // ---- Polling ----
    public void pollingRun(String outcome) {
        Counter.builder("cmdb_polling_runs_total")
                .tag("outcome", outcome) // success | failure | skipped
                .register(registry)
                .increment();
    }

    // ---- Outbox ----
    public void outboxProcessed(String eventType, String outcome) {
        Counter.builder("cmdb_outbox_events_total")
                .tag("type", eventType)
                .tag("outcome", outcome) // processed | retry | failed
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDuration(String metricName, String key, long nanos) {
        Timer.builder(metricName)
                .tag("key", key)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
