package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Failure talking to the workflow engine. {@link #getCode()} is either one of the constants below
 * or an engine-supplied code, preserved verbatim.
 */
@Getter
public class N8nClientException extends RuntimeException {

    public static final String AUTHENTICATION_FAILED = "AUTHENTICATION_FAILED";
    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String CONNECTION_ERROR = "CONNECTION_ERROR";
    public static final String TIMEOUT_ERROR = "TIMEOUT_ERROR";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String UPSTREAM_ERROR = "UPSTREAM_ERROR";
    public static final String WORKFLOW_EXECUTION_ERROR = "WORKFLOW_EXECUTION_ERROR";
    public static final String NODE_EXECUTION_ERROR = "NODE_EXECUTION_ERROR";

    private final String code;
    /** HTTP status returned by the engine, null when no response was received. */
    private final Integer upstreamStatus;
    private final boolean retryable;
    private final transient JsonNode details;

    public N8nClientException(String code, String message, Integer upstreamStatus, boolean retryable,
                              JsonNode details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.upstreamStatus = upstreamStatus;
        this.retryable = retryable;
        this.details = details;
    }

    public N8nClientException(String code, String message, Integer upstreamStatus, boolean retryable) {
        this(code, message, upstreamStatus, retryable, null, null);
    }
}
