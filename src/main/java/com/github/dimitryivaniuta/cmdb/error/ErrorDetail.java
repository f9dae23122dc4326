package com.github.dimitryivaniuta.cmdb.error;

public record ErrorDetail(String code, String message, String field) {

    public static ErrorDetail of(String code, String message) {
        return new ErrorDetail(code, message, null);
    }
}
