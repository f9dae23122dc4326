package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Guesses the resource type and cloud provider a remote workflow manages from its name and node
 * types. Rules are checked in order; the first match wins.
 */
public final class WorkflowClassifier {
    private WorkflowClassifier() {}

    public static WorkflowType inferType(String searchText) {
        String s = normalize(searchText);
        if (s.contains("transit") || s.contains("tgw")) return WorkflowType.TRANSIT_GATEWAY;
        if (s.contains("nat") || s.contains("gateway")) return WorkflowType.NAT_GATEWAY;
        if (s.contains("vpn") || s.contains("tunnel")) return WorkflowType.VPN;
        if (s.contains("subnet")) return WorkflowType.SUBNET;
        return WorkflowType.VPC;
    }

    public static WorkflowProvider inferProvider(String searchText) {
        String s = normalize(searchText);
        if (s.contains("aws") || s.contains("amazon")) return WorkflowProvider.AWS;
        if (s.contains("azure") || s.contains("microsoft")) return WorkflowProvider.AZURE;
        if (s.contains("gcp") || s.contains("google")) return WorkflowProvider.GCP;
        if (s.contains("alibaba") || s.contains("aliyun")) return WorkflowProvider.ALI;
        if (s.contains("oracle") || s.contains("oci")) return WorkflowProvider.OCI;
        if (s.contains("huawei")) return WorkflowProvider.HUAWEI;
        return WorkflowProvider.OTHERS;
    }

    /** Workflow name followed by the type of every node, space separated. */
    public static String searchText(JsonNode workflow) {
        String name = workflow.path("name").asText("");
        JsonNode nodes = workflow.path("nodes");
        String nodeTypes = nodes.isArray()
                ? StreamSupport.stream(nodes.spliterator(), false)
                        .map(n -> n.path("type").asText(""))
                        .collect(Collectors.joining(" "))
                : "";
        return name + " " + nodeTypes;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
