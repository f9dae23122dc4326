package com.github.dimitryivaniuta.cmdb.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Base of the domain error taxonomy. Each subtype fixes the HTTP status it is reported with;
 * {@link #getErrors()} always holds at least one entry.
 */
@Getter
public abstract class CmdbException extends RuntimeException {

    private final HttpStatus status;
    private final List<ErrorDetail> errors;

    protected CmdbException(HttpStatus status, String message, List<ErrorDetail> errors) {
        super(message);
        this.status = status;
        this.errors = List.copyOf(errors);
    }

    protected CmdbException(HttpStatus status, String message, List<ErrorDetail> errors, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errors = List.copyOf(errors);
    }

    public String getCode() {
        return errors.get(0).code();
    }
}
