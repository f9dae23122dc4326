package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Local execution status. Engine statuses are folded onto these four by {@link #fromRemote(String)}.
 */
public enum ExecutionStatus {
    SUCCESS("success"),
    FAILURE("failure"),
    RUNNING("running"),
    CANCELLED("cancelled");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * succeeded → success; failed, crashed → failure; new, running, waiting → running;
     * canceled → cancelled; anything else (including null) → failure.
     */
    public static ExecutionStatus fromRemote(String remoteStatus) {
        if (remoteStatus == null) {
            return FAILURE;
        }
        return switch (remoteStatus.toLowerCase(Locale.ROOT)) {
            case "succeeded" -> SUCCESS;
            case "failed", "crashed" -> FAILURE;
            case "new", "running", "waiting" -> RUNNING;
            case "canceled" -> CANCELLED;
            default -> FAILURE;
        };
    }

    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
