package com.github.dimitryivaniuta.cmdb.report;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record PreviewRequest(
        @NotBlank(message = "queryName is required") String queryName,
        Map<String, Object> parameters,
        Integer page,
        Integer limit
) {
}
