package com.github.dimitryivaniuta.cmdb.report;

import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.dimitryivaniuta.cmdb.report.NamedReportQuery.Param.integer;
import static com.github.dimitryivaniuta.cmdb.report.NamedReportQuery.Param.text;

/**
 * The fixed set of queries reports can run. Optional filters use {@code CAST(:x AS text) IS NULL}
 * so an absent argument disables the predicate.
 */
@Component
public class ReportQueryCatalog {

    public static final String UNKNOWN_QUERY = "UNKNOWN_QUERY";

    static final String WORKFLOW_SOURCE = "WORKFLOW";

    private static final String COMMON_FILTERS = """
              AND (CAST(:region AS text) IS NULL OR t.region = :region)
              AND (CAST(:state AS text) IS NULL OR t.state = :state)
              AND (CAST(:environment AS text) IS NULL OR t.environment = :environment)
            """;

    private static final List<NamedReportQuery.Param> RESOURCE_PARAMS =
            List.of(text("region"), text("state"), text("environment"));

    private final Map<String, NamedReportQuery> queries = new LinkedHashMap<>();

    public ReportQueryCatalog() {
        register(new NamedReportQuery("vpc_inventory", "Active VPCs with CIDR and DNS settings", """
                SELECT t.id, t.vpc_id, t.name, t.region, t.aws_account_id, t.state, t.cidr_block,
                       t.instance_tenancy, t.is_default, t.environment, t.owner, t.created_at
                FROM vpc t
                WHERE t.deleted_at IS NULL
                """ + COMMON_FILTERS + """
                ORDER BY t.region, t.vpc_id
                """, RESOURCE_PARAMS, Set.of(ResourceType.VPC.name())));

        register(new NamedReportQuery("transit_gateway_inventory", "Active transit gateways", """
                SELECT t.id, t.transit_gateway_id, t.name, t.region, t.aws_account_id, t.state,
                       t.amazon_side_asn, t.dns_support, t.vpn_ecmp_support, t.environment, t.owner, t.created_at
                FROM transit_gateway t
                WHERE t.deleted_at IS NULL
                """ + COMMON_FILTERS + """
                ORDER BY t.region, t.transit_gateway_id
                """, RESOURCE_PARAMS, Set.of(ResourceType.TRANSIT_GATEWAY.name())));

        register(new NamedReportQuery("customer_gateway_inventory", "Active customer gateways", """
                SELECT t.id, t.customer_gateway_id, t.name, t.region, t.aws_account_id, t.state,
                       t.gateway_type, t.ip_address, t.bgp_asn, t.device_name, t.environment, t.owner, t.created_at
                FROM customer_gateway t
                WHERE t.deleted_at IS NULL
                """ + COMMON_FILTERS + """
                ORDER BY t.region, t.customer_gateway_id
                """, RESOURCE_PARAMS, Set.of(ResourceType.CUSTOMER_GATEWAY.name())));

        register(new NamedReportQuery("vpc_endpoint_inventory", "Active VPC endpoints by service", """
                SELECT t.id, t.vpc_endpoint_id, t.vpc_id, t.name, t.region, t.state, t.service_name,
                       t.vpc_endpoint_type, t.private_dns_enabled, t.environment, t.owner, t.created_at
                FROM vpc_endpoint t
                WHERE t.deleted_at IS NULL
                """ + COMMON_FILTERS + """
                ORDER BY t.region, t.service_name, t.vpc_endpoint_id
                """, RESOURCE_PARAMS, Set.of(ResourceType.VPC_ENDPOINT.name())));

        register(new NamedReportQuery("resource_summary", "Resource counts by type, region and state", """
                SELECT t.resource_type, t.region, t.state, COUNT(*) AS resource_count
                FROM (
                    SELECT 'vpc' AS resource_type, region, state FROM vpc WHERE deleted_at IS NULL
                    UNION ALL
                    SELECT 'transit_gateway', region, state FROM transit_gateway WHERE deleted_at IS NULL
                    UNION ALL
                    SELECT 'customer_gateway', region, state FROM customer_gateway WHERE deleted_at IS NULL
                    UNION ALL
                    SELECT 'vpc_endpoint', region, state FROM vpc_endpoint WHERE deleted_at IS NULL
                ) t
                WHERE (CAST(:region AS text) IS NULL OR t.region = :region)
                GROUP BY t.resource_type, t.region, t.state
                ORDER BY t.resource_type, t.region, t.state
                """, List.of(text("region")), Set.of(
                        ResourceType.VPC.name(), ResourceType.TRANSIT_GATEWAY.name(),
                        ResourceType.CUSTOMER_GATEWAY.name(), ResourceType.VPC_ENDPOINT.name())));

        register(new NamedReportQuery("workflow_execution_summary", "Per workflow outcome counts and average duration", """
                SELECT r.workflow_id, r.workflow_name, r.workflow_type, r.provider, r.is_active,
                       COUNT(e.id) AS total_executions,
                       COUNT(e.id) FILTER (WHERE e.status = 'success') AS successful_executions,
                       COUNT(e.id) FILTER (WHERE e.status = 'failure') AS failed_executions,
                       COALESCE(ROUND(AVG(e.duration_ms)), 0) AS avg_duration_ms,
                       MAX(e.start_time) AS last_execution_at
                FROM workflow_registry r
                LEFT JOIN workflow_execution e ON e.workflow_id = r.workflow_id
                WHERE (CAST(:workflowId AS text) IS NULL OR r.workflow_id = :workflowId)
                  AND (CAST(:provider AS text) IS NULL OR r.provider = :provider)
                GROUP BY r.workflow_id, r.workflow_name, r.workflow_type, r.provider, r.is_active
                ORDER BY r.workflow_id
                """, List.of(text("workflowId"), text("provider")), Set.of(WORKFLOW_SOURCE)));

        register(new NamedReportQuery("recent_workflow_failures", "Failed executions within the last N hours", """
                SELECT e.execution_id, e.workflow_id, r.workflow_name, e.start_time, e.end_time,
                       e.duration_ms, e.error_message
                FROM workflow_execution e
                LEFT JOIN workflow_registry r ON r.workflow_id = e.workflow_id
                WHERE e.status = 'failure'
                  AND e.start_time >= now() - make_interval(hours => CAST(:hours AS int))
                ORDER BY e.start_time DESC
                """, List.of(integer("hours", 24)), Set.of(WORKFLOW_SOURCE)));
    }

    private void register(NamedReportQuery query) {
        queries.put(query.name(), query);
    }

    public NamedReportQuery require(String name) {
        NamedReportQuery q = name == null ? null : queries.get(name);
        if (q == null) {
            throw new ValidationFailedException(List.of(new ErrorDetail(UNKNOWN_QUERY,
                    "Unknown query '" + name + "'; expected one of " + queries.keySet(), "queryName")));
        }
        return q;
    }

    public boolean contains(String name) {
        return queries.containsKey(name);
    }

    public Collection<NamedReportQuery> all() {
        return queries.values();
    }

    /** Queries whose results depend on the given event source. */
    public List<NamedReportQuery> dependingOn(String source) {
        return queries.values().stream()
                .filter(q -> q.sources().contains(source))
                .toList();
    }
}
