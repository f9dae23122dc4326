package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * The fields of an engine execution payload the registry cares about.
 */
public record RemoteExecution(
        String id,
        String workflowId,
        String status,
        Instant startedAt,
        Instant stoppedAt,
        JsonNode data
) {

    public static RemoteExecution from(JsonNode node, String fallbackWorkflowId) {
        String id = text(node, "id");
        if (id == null) {
            id = text(node, "executionId");
        }
        String workflowId = text(node, "workflowId");
        String status = text(node, "status");
        if (status == null && node.has("finished")) {
            // older engine releases report only the finished flag
            status = node.path("finished").asBoolean() ? "succeeded" : "running";
        }
        return new RemoteExecution(
                id,
                workflowId != null ? workflowId : fallbackWorkflowId,
                status,
                instant(text(node, "startedAt")),
                instant(text(node, "stoppedAt")),
                node.get("data"));
    }

    public ExecutionStatus localStatus() {
        return ExecutionStatus.fromRemote(status);
    }

    public Long durationMs() {
        if (startedAt == null || stoppedAt == null) {
            return null;
        }
        return Duration.between(startedAt, stoppedAt).toMillis();
    }

    /** {@code data.resultData.error.message}, or null. */
    public String errorMessage() {
        if (data == null) {
            return null;
        }
        JsonNode message = data.path("resultData").path("error").path("message");
        return message.isTextual() ? message.asText() : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            return Instant.parse(value);
        }
    }
}
