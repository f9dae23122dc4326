package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    FAILURE("failure"),
    SUCCESS("success"),
    MANUAL_TRIGGER("manual_trigger");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static AlertType fromValue(String value) {
        for (AlertType t : values()) {
            if (t.value.equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + value);
    }
}
