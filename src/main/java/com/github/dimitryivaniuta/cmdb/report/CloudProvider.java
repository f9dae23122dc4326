package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum CloudProvider {
    AWS("aws"),
    AZURE("azure"),
    GCP("gcp"),
    OCI("oci"),
    MULTI_CLOUD("multi_cloud"),
    ALL("all");

    private final String value;

    CloudProvider(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CloudProvider fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cloud provider: " + value));
    }
}
