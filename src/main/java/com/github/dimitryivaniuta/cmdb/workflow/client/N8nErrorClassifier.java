package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;

import static com.github.dimitryivaniuta.cmdb.workflow.client.N8nClientException.*;

/**
 * Maps transport failures and non-2xx engine responses onto the client error taxonomy.
 * An engine error body of the form {@code {"error":{"code":..,"message":..,"details":..}}} wins
 * over the status-based mapping.
 */
@Component
@RequiredArgsConstructor
public class N8nErrorClassifier {

    static final Set<String> RETRYABLE_CODES = Set.of(
            CONNECTION_ERROR, TIMEOUT_ERROR, RATE_LIMIT_EXCEEDED, WORKFLOW_EXECUTION_ERROR, NODE_EXECUTION_ERROR);

    private final ObjectMapper mapper;

    public N8nClientException fromResponse(int status, String body) {
        JsonNode error = engineError(body);
        if (error != null) {
            String code = error.get("code").asText();
            String message = error.path("message").asText("Workflow engine error " + code);
            JsonNode details = error.get("details");
            return new N8nClientException(code, message, status, isRetryable(code, status), details, null);
        }

        String code;
        String message;
        if (status == 401) {
            code = AUTHENTICATION_FAILED;
            message = "n8n authentication failed. Check API key.";
        } else if (status == 429) {
            code = RATE_LIMIT_EXCEEDED;
            message = "n8n rate limit exceeded. Please retry later.";
        } else if (status >= 500) {
            code = CONNECTION_ERROR;
            message = "n8n server error (HTTP " + status + ")";
        } else if (status == 400 || status == 422) {
            code = VALIDATION_ERROR;
            message = plainMessage(body, "n8n rejected the request");
        } else if (status == 404) {
            code = NOT_FOUND;
            message = plainMessage(body, "n8n resource not found");
        } else {
            code = UPSTREAM_ERROR;
            message = plainMessage(body, "Unexpected n8n response (HTTP " + status + ")");
        }
        return new N8nClientException(code, message, status, isRetryable(code, status));
    }

    public N8nClientException fromTransport(IOException ex) {
        // SocketTimeoutException is an InterruptedIOException; so is OkHttp's call timeout
        if (ex instanceof InterruptedIOException) {
            return new N8nClientException(TIMEOUT_ERROR, "n8n request timed out: " + ex.getMessage(),
                    null, true, null, ex);
        }
        return new N8nClientException(CONNECTION_ERROR, "Cannot reach n8n: " + ex.getMessage(),
                null, true, null, ex);
    }

    static boolean isRetryable(String code, int status) {
        return RETRYABLE_CODES.contains(code) || status >= 500 || status == 429;
    }

    private JsonNode engineError(String body) {
        JsonNode root = parse(body);
        if (root == null) {
            return null;
        }
        JsonNode error = root.get("error");
        if (error != null && error.isObject() && error.hasNonNull("code") && error.get("code").isTextual()) {
            return error;
        }
        return null;
    }

    private String plainMessage(String body, String fallback) {
        JsonNode root = parse(body);
        if (root != null && root.hasNonNull("message")) {
            return root.get("message").asText();
        }
        return fallback;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
