package com.github.dimitryivaniuta.cmdb.bulk;

import java.util.List;

public record BulkResult(
        String operation,
        int requested,
        int succeeded,
        List<Long> succeededIds,
        List<ItemError> errors
) {

    /**
     * @param id the row id for deletes; null for creates
     */
    public record ItemError(int index, Long id, String code, String message) {
    }
}
