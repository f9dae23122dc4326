package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ReportQueryExecutorTest {

    private final ReportQueryCatalog catalog = new ReportQueryCatalog();
    private DataSource dataSource;
    private ReportCache cache;
    private SimpleMeterRegistry registry;
    private ReportQueryExecutor executor;

    @BeforeEach
    void setUp() {
        dataSource = mock(DataSource.class);
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        cache = new ReportCache(mapper, Duration.ofMinutes(10), 1_000, Ticker.systemTicker());
        registry = new SimpleMeterRegistry();
        executor = new ReportQueryExecutor(dataSource, catalog, cache, new ReportProperties(), new CmdbMetrics(registry));
    }

    @Test
    void unknownQueryIsRejected() {
        assertThatThrownBy(() -> executor.execute("drop_everything", Map.of(), QueryOptions.defaults()))
                .isInstanceOfSatisfying(ValidationFailedException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(ReportQueryCatalog.UNKNOWN_QUERY);
                    assertThat(ex.getErrors().get(0).field()).isEqualTo("queryName");
                });
        verifyNoInteractions(dataSource);
    }

    @Test
    void undeclaredParametersAreRejected() {
        NamedReportQuery query = catalog.require("vpc_inventory");

        assertThatThrownBy(() -> executor.resolveArguments(query, Map.of("region", "us-east-1", "sql", "1=1")))
                .isInstanceOfSatisfying(ValidationFailedException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .containsExactly("sql"));
    }

    @Test
    void missingParametersGetDefaultsAndBlankTextBecomesNull() {
        Map<String, Object> params = new HashMap<>();
        params.put("region", "  ");
        params.put("state", "available");

        Map<String, Object> args = executor.resolveArguments(catalog.require("vpc_inventory"), params);

        assertThat(args).containsOnly(entry("region", null), entry("state", "available"), entry("environment", null));
        assertThat(args.keySet()).containsExactly("environment", "region", "state");
    }

    @Test
    void integerParametersAreCoerced() {
        NamedReportQuery failures = catalog.require("recent_workflow_failures");

        assertThat(executor.resolveArguments(failures, Map.of())).containsEntry("hours", 24);
        assertThat(executor.resolveArguments(failures, Map.of("hours", "48"))).containsEntry("hours", 48);
        assertThat(executor.resolveArguments(failures, Map.of("hours", 6L))).containsEntry("hours", 6);
        assertThatThrownBy(() -> executor.resolveArguments(failures, Map.of("hours", "a day")))
                .isInstanceOf(ValidationFailedException.class);
    }

    @Test
    void cachedResultIsServedWithoutTouchingTheDatabase() {
        Map<String, Object> args = executor.resolveArguments(catalog.require("vpc_inventory"), Map.of("region", "us-east-1"));
        List<Map<String, Object>> rows = List.of(Map.of("vpc_id", "vpc-0a1b2c3d"));
        cache.set(cache.key("vpc_inventory", args), rows);

        QueryResult result = executor.execute("vpc_inventory", Map.of("region", "us-east-1"), QueryOptions.defaults());

        assertThat(result.fromCache()).isTrue();
        assertThat(result.rows()).isEqualTo(rows);
        assertThat(result.rowCount()).isEqualTo(1);
        assertThat(registry.get("cmdb_report_cache_hits_total").tag("query", "vpc_inventory").counter().count())
                .isEqualTo(1.0);
        verifyNoInteractions(dataSource);
    }

    @Test
    void catalogTracksWhichQueriesReadWhichData() {
        assertThat(catalog.dependingOn("VPC")).extracting(NamedReportQuery::name)
                .containsExactly("vpc_inventory", "resource_summary");
        assertThat(catalog.dependingOn(ReportQueryCatalog.WORKFLOW_SOURCE)).extracting(NamedReportQuery::name)
                .containsExactly("workflow_execution_summary", "recent_workflow_failures");
        assertThat(catalog.all()).hasSize(7);
    }
}
