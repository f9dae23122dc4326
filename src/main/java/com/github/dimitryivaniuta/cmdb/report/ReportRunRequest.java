package com.github.dimitryivaniuta.cmdb.report;

import java.util.Map;

/**
 * Body of {@code POST /api/reports/{reportId}/run}; parameters override the definition's defaults.
 */
public record ReportRunRequest(
        Map<String, Object> parameters,
        TriggerType triggerType,
        Boolean useCache
) {
}
