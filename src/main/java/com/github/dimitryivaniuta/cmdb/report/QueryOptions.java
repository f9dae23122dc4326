package com.github.dimitryivaniuta.cmdb.report;

import java.time.Duration;

/**
 * Per-call knobs for {@link ReportQueryExecutor}; {@code null} members fall back to
 * {@code cmdb.report.*}.
 */
public record QueryOptions(
        Boolean useCache,
        Duration cacheTtl,
        Duration timeout,
        Integer maxRows
) {

    public static QueryOptions defaults() {
        return new QueryOptions(null, null, null, null);
    }

    public static QueryOptions noCache() {
        return new QueryOptions(false, null, null, null);
    }

    public boolean cacheEnabled() {
        return useCache == null || useCache;
    }
}
