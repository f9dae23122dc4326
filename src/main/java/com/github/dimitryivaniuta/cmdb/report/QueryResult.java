package com.github.dimitryivaniuta.cmdb.report;

import java.util.List;
import java.util.Map;

public record QueryResult(
        String queryName,
        List<Map<String, Object>> rows,
        int rowCount,
        boolean fromCache,
        long executionTimeMs
) {
}
