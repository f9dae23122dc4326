package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum WorkflowType {
    VPC("vpc"),
    SUBNET("subnet"),
    TRANSIT_GATEWAY("transit_gateway"),
    NAT_GATEWAY("nat_gateway"),
    VPN("vpn");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow type: " + value));
    }
}
