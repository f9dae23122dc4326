package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationFailedException extends CmdbException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationFailedException(List<ErrorDetail> errors) {
        super(HttpStatus.BAD_REQUEST, "Validation failed", errors);
    }

    public static ValidationFailedException of(String field, String message) {
        return new ValidationFailedException(List.of(new ErrorDetail(CODE, message, field)));
    }
}
