package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class N8nErrorClassifierTest {

    private final N8nErrorClassifier classifier = new N8nErrorClassifier(new ObjectMapper());

    @ParameterizedTest
    @CsvSource({
            "401, AUTHENTICATION_FAILED, false",
            "429, RATE_LIMIT_EXCEEDED, true",
            "500, CONNECTION_ERROR, true",
            "503, CONNECTION_ERROR, true",
            "400, VALIDATION_ERROR, false",
            "422, VALIDATION_ERROR, false",
            "404, NOT_FOUND, false",
            "409, UPSTREAM_ERROR, false"
    })
    void mapsStatusToCode(int status, String code, boolean retryable) {
        N8nClientException ex = classifier.fromResponse(status, "");

        assertThat(ex.getCode()).isEqualTo(code);
        assertThat(ex.isRetryable()).isEqualTo(retryable);
        assertThat(ex.getUpstreamStatus()).isEqualTo(status);
    }

    @Test
    void engineErrorCodeIsPreserved() {
        String body = """
                {"error":{"code":"WORKFLOW_EXECUTION_ERROR","message":"Node failed","details":{"node":"HTTP"}}}
                """;

        N8nClientException ex = classifier.fromResponse(400, body);

        assertThat(ex.getCode()).isEqualTo("WORKFLOW_EXECUTION_ERROR");
        assertThat(ex.getMessage()).isEqualTo("Node failed");
        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getDetails().path("node").asText()).isEqualTo("HTTP");
    }

    @Test
    void unknownEngineCodeOnServerErrorIsRetryable() {
        N8nClientException ex = classifier.fromResponse(502, "{\"error\":{\"code\":\"ENGINE_BUSY\"}}");

        assertThat(ex.getCode()).isEqualTo("ENGINE_BUSY");
        assertThat(ex.isRetryable()).isTrue();
    }

    @Test
    void plainMessageIsUsedForClientErrors() {
        N8nClientException ex = classifier.fromResponse(404, "{\"message\":\"Workflow 7 not found\"}");

        assertThat(ex.getMessage()).isEqualTo("Workflow 7 not found");
    }

    @Test
    void transportFailuresAreRetryable() {
        N8nClientException timeout = classifier.fromTransport(new SocketTimeoutException("read timed out"));
        N8nClientException refused = classifier.fromTransport(new ConnectException("refused"));
        N8nClientException other = classifier.fromTransport(new IOException("reset"));

        assertThat(timeout.getCode()).isEqualTo(N8nClientException.TIMEOUT_ERROR);
        assertThat(refused.getCode()).isEqualTo(N8nClientException.CONNECTION_ERROR);
        assertThat(other.getCode()).isEqualTo(N8nClientException.CONNECTION_ERROR);
        assertThat(timeout.isRetryable()).isTrue();
        assertThat(refused.getUpstreamStatus()).isNull();
    }
}
