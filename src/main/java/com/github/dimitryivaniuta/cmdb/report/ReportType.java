package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ReportType {
    VPC_INVENTORY("vpc_inventory"),
    TRANSIT_GATEWAY_INVENTORY("transit_gateway_inventory"),
    CUSTOMER_GATEWAY_INVENTORY("customer_gateway_inventory"),
    VPC_ENDPOINT_INVENTORY("vpc_endpoint_inventory"),
    RESOURCE_SUMMARY("resource_summary"),
    WORKFLOW_EXECUTION_SUMMARY("workflow_execution_summary"),
    CUSTOM_QUERY("custom_query");

    private final String value;

    ReportType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ReportType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown report type: " + value));
    }
}
