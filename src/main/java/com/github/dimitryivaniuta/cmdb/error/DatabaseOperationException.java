package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class DatabaseOperationException extends CmdbException {

    public static final String DUPLICATE_RECORD = "DUPLICATE_RECORD";
    public static final String FOREIGN_KEY_VIOLATION = "FOREIGN_KEY_VIOLATION";
    public static final String REQUIRED_FIELD_MISSING = "REQUIRED_FIELD_MISSING";
    public static final String DATABASE_ERROR = "DATABASE_ERROR";
    public static final String QUERY_TIMEOUT = "QUERY_TIMEOUT";

    public DatabaseOperationException(HttpStatus status, String code, String message, Throwable cause) {
        super(status, message, List.of(ErrorDetail.of(code, message)), cause);
    }
}
