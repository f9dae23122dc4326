package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ReportCategory {
    INFRASTRUCTURE("infrastructure"),
    SECURITY("security"),
    COMPLIANCE("compliance"),
    COST("cost"),
    PERFORMANCE("performance"),
    OPERATIONAL("operational"),
    AUDIT("audit");

    private final String value;

    ReportCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ReportCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown report category: " + value));
    }
}
