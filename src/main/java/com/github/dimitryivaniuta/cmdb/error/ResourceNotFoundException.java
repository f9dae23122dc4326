package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ResourceNotFoundException extends CmdbException {

    public ResourceNotFoundException(String code, String message) {
        super(HttpStatus.NOT_FOUND, message, List.of(ErrorDetail.of(code, message)));
    }
}
