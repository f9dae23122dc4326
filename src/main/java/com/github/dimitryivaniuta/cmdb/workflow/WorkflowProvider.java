package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum WorkflowProvider {
    AWS("aws"),
    AZURE("azure"),
    GCP("gcp"),
    ALI("ali"),
    OCI("oci"),
    HUAWEI("huawei"),
    OTHERS("others");

    private final String value;

    WorkflowProvider(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowProvider fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow provider: " + value));
    }
}
