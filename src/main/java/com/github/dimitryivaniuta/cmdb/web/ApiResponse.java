package com.github.dimitryivaniuta.cmdb.web;

import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;

import java.util.List;

/**
 * JSON envelope shared by every {@code /api} endpoint.
 * Absent members are dropped by the mapper, so a plain success carries only {@code success} and {@code data}.
 */
public record ApiResponse<T>(
        boolean success,
        T data,
        String message,
        List<ErrorDetail> errors,
        PageMeta pagination
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message, null, null);
    }

    public static <T> ApiResponse<List<T>> page(List<T> data, PageMeta pagination) {
        return new ApiResponse<>(true, data, null, null, pagination);
    }

    public static <T> ApiResponse<T> failure(String message, List<ErrorDetail> errors) {
        return new ApiResponse<>(false, null, message, errors, null);
    }
}
