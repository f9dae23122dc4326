package com.github.dimitryivaniuta.cmdb.report;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Which catalog query a report runs and with which default arguments.
 * Stored as the {@code query_config} jsonb column.
 */
public record QueryConfig(
        @NotBlank(message = "queryConfig.queryName is required") String queryName,
        Map<String, Object> parameters,
        @Min(1) @Max(100_000) Integer maxRows,
        @Min(0) @Max(86_400) Integer cacheTtlSeconds
) {
}
