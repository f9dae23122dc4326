package com.github.dimitryivaniuta.cmdb.report;

import java.util.List;
import java.util.Map;

/**
 * @param truncated whether {@code rows} holds fewer rows than the query produced
 */
public record ReportRunResult(
        ReportExecution execution,
        List<Map<String, Object>> rows,
        boolean truncated
) {
}
