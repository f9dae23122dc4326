package com.github.dimitryivaniuta.cmdb.web;

import com.github.dimitryivaniuta.cmdb.error.DatabaseOperationException;
import com.github.dimitryivaniuta.cmdb.error.RateLimitExceededException;
import com.github.dimitryivaniuta.cmdb.error.ResourceNotFoundException;
import com.github.dimitryivaniuta.cmdb.workflow.client.N8nClientException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/workflows/7/trigger");

    @Test
    void engineFailuresMapToGatewayStatuses() {
        assertThat(GlobalExceptionHandler.statusFor(client(N8nClientException.CONNECTION_ERROR)))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusFor(client(N8nClientException.TIMEOUT_ERROR)))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusFor(client(N8nClientException.RATE_LIMIT_EXCEEDED)))
                .isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(GlobalExceptionHandler.statusFor(client(N8nClientException.AUTHENTICATION_FAILED)))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(GlobalExceptionHandler.statusFor(client("NODE_EXECUTION_ERROR")))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void engineRateLimitCarriesRetryAfter() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleN8n(client(N8nClientException.RATE_LIMIT_EXCEEDED), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("60");
        assertThat(response.getBody().errors().get(0).code()).isEqualTo(N8nClientException.RATE_LIMIT_EXCEEDED);
    }

    @Test
    void inboundRateLimitUsesExceptionRetryAfter() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleRateLimit(new RateLimitExceededException("slow down", 42));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("42");
        assertThat(response.getBody().success()).isFalse();
    }

    @Test
    void domainErrorKeepsItsStatusAndCode() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleCmdb(
                new ResourceNotFoundException("VPC_NOT_FOUND", "VPC with id 9 not found"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).isEqualTo("VPC with id 9 not found");
        assertThat(response.getBody().errors().get(0).code()).isEqualTo("VPC_NOT_FOUND");
    }

    @Test
    void foreignKeyViolationIsABadRequest() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleDataAccess(new DataIntegrityViolationException("fk",
                new SQLException("violates foreign key constraint", "23503")), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errors().get(0).code()).isEqualTo(DatabaseOperationException.FOREIGN_KEY_VIOLATION);
    }

    @Test
    void unexpectedErrorsAreOpaque() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleGeneric(new IllegalStateException("secret detail"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errors().get(0).code()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().message()).doesNotContain("secret");
    }

    private static N8nClientException client(String code) {
        return new N8nClientException(code, "n8n said no", null, false);
    }
}
