package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.resource.DataChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReportCacheInvalidatorTest {

    private final ReportCache cache = new ReportCache(new ObjectMapper(), Duration.ofMinutes(10), 100, Ticker.systemTicker());
    private final ReportCacheInvalidator invalidator = new ReportCacheInvalidator(new ReportQueryCatalog(), cache);

    @Test
    void vpcChangeDropsVpcAndSummaryResultsOnly() {
        cache.set("report:vpc_inventory:aaa", 1);
        cache.set("report:resource_summary:bbb", 2);
        cache.set("report:transit_gateway_inventory:ccc", 3);
        cache.set("report:workflow_execution_summary:ddd", 4);

        invalidator.onDataChanged(new DataChangedEvent("VPC", "10", "UPDATE"));

        assertThat(cache.get("report:vpc_inventory:aaa")).isEmpty();
        assertThat(cache.get("report:resource_summary:bbb")).isEmpty();
        assertThat(cache.get("report:transit_gateway_inventory:ccc")).contains(3);
        assertThat(cache.get("report:workflow_execution_summary:ddd")).contains(4);
    }

    @Test
    void workflowChangeDropsWorkflowQueries() {
        cache.set("report:workflow_execution_summary:ddd", 4);
        cache.set("report:recent_workflow_failures:eee", 5);
        cache.set("report:vpc_inventory:aaa", 1);

        invalidator.onDataChanged(new DataChangedEvent("WORKFLOW", "wf-1", "POLL"));

        assertThat(cache.get("report:workflow_execution_summary:ddd")).isEmpty();
        assertThat(cache.get("report:recent_workflow_failures:eee")).isEmpty();
        assertThat(cache.get("report:vpc_inventory:aaa")).contains(1);
    }
}
