package com.github.dimitryivaniuta.cmdb.resource;

import java.util.Arrays;
import java.util.Optional;

public enum ResourceType {

    VPC("vpcs", "VPC"),
    TRANSIT_GATEWAY("transit-gateways", "Transit gateway"),
    CUSTOMER_GATEWAY("customer-gateways", "Customer gateway"),
    VPC_ENDPOINT("vpc-endpoints", "VPC endpoint");

    private final String path;
    private final String displayName;

    ResourceType(String path, String displayName) {
        this.path = path;
        this.displayName = displayName;
    }

    public String path() {
        return path;
    }

    public String displayName() {
        return displayName;
    }

    public String duplicateCode() {
        return "DUPLICATE_" + name();
    }

    public String notFoundCode() {
        return name() + "_NOT_FOUND";
    }

    /** Accepts the URL segment ({@code vpc-endpoints}) or the enum name ({@code VPC_ENDPOINT}). */
    public static Optional<ResourceType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.path.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v.replace('-', '_')))
                .findFirst();
    }
}
