package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class DuplicateResourceException extends CmdbException {

    public DuplicateResourceException(String code, String message, String field) {
        super(HttpStatus.CONFLICT, message, List.of(new ErrorDetail(code, message, field)));
    }
}
