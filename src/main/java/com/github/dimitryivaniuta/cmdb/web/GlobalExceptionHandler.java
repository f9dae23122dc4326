package com.github.dimitryivaniuta.cmdb.web;

import com.github.dimitryivaniuta.cmdb.error.CmdbException;
import com.github.dimitryivaniuta.cmdb.error.DatabaseErrorTranslator;
import com.github.dimitryivaniuta.cmdb.error.DatabaseOperationException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.RateLimitExceededException;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.workflow.client.N8nClientException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Comparator;
import java.util.List;

/**
 * Maps every failure to the {@link ApiResponse} envelope with {@code success=false}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final long UPSTREAM_RETRY_AFTER_SECONDS = 60;

    @ExceptionHandler(CmdbException.class)
    public ResponseEntity<ApiResponse<Void>> handleCmdb(CmdbException ex, HttpServletRequest req) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("{} {} failed with {}", req.getMethod(), req.getRequestURI(), ex.getCode(), ex);
        } else {
            log.debug("{} {} rejected with {}: {}", req.getMethod(), req.getRequestURI(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(ApiResponse.failure(ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(N8nClientException.class)
    public ResponseEntity<ApiResponse<Void>> handleN8n(N8nClientException ex, HttpServletRequest req) {
        HttpStatus status = statusFor(ex);
        log.warn("{} {} failed calling n8n: code={} upstreamStatus={} message={}",
                req.getMethod(), req.getRequestURI(), ex.getCode(), ex.getUpstreamStatus(), ex.getMessage());
        HttpHeaders h = new HttpHeaders();
        if (status == HttpStatus.TOO_MANY_REQUESTS) {
            h.set(HttpHeaders.RETRY_AFTER, String.valueOf(UPSTREAM_RETRY_AFTER_SECONDS));
        }
        ApiResponse<Void> body = ApiResponse.failure("Workflow engine request failed",
                List.of(ErrorDetail.of(ex.getCode(), ex.getMessage())));
        return new ResponseEntity<>(body, h, status);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleRateLimit(RateLimitExceededException ex) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, ex.getRetryAfterSeconds())));
        ApiResponse<Void> body = ApiResponse.failure(ex.getMessage(),
                List.of(ErrorDetail.of(RateLimitExceededException.CODE, ex.getMessage())));
        return new ResponseEntity<>(body, h, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<Void>> handleBinding(BindException ex) {
        List<ErrorDetail> errors = ex.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(fe -> new ErrorDetail(ValidationFailedException.CODE, fe.getDefaultMessage(), fe.getField()))
                .toList();
        if (errors.isEmpty()) {
            errors = List.of(ErrorDetail.of(ValidationFailedException.CODE, "Invalid request"));
        }
        return ResponseEntity.badRequest().body(ApiResponse.failure("Validation failed", errors));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception ex) {
        String message = ex instanceof MethodArgumentTypeMismatchException mm
                ? "Parameter '" + mm.getName() + "' has an invalid value"
                : ex instanceof MissingServletRequestParameterException mp
                ? "Parameter '" + mp.getParameterName() + "' is required"
                : "Malformed request body";
        return ResponseEntity.badRequest().body(ApiResponse.failure("Validation failed",
                List.of(ErrorDetail.of(ValidationFailedException.CODE, message))));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(DataAccessException ex, HttpServletRequest req) {
        DatabaseOperationException translated = DatabaseErrorTranslator.translate(ex);
        log.error("{} {} database failure ({})", req.getMethod(), req.getRequestURI(), translated.getCode(), ex);
        return ResponseEntity.status(translated.getStatus())
                .body(ApiResponse.failure(translated.getMessage(), translated.getErrors()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> noResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Not found",
                List.of(ErrorDetail.of("NOT_FOUND", "No endpoint " + ex.getResourcePath()))));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure("Unexpected error",
                List.of(ErrorDetail.of("INTERNAL_ERROR", "Unexpected error"))));
    }

    static HttpStatus statusFor(N8nClientException ex) {
        return switch (ex.getCode()) {
            case N8nClientException.CONNECTION_ERROR, N8nClientException.TIMEOUT_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case N8nClientException.RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            default -> HttpStatus.BAD_GATEWAY;
        };
    }
}
