package com.github.dimitryivaniuta.cmdb.bulk;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * {@code items} carries create payloads in the resource's own request shape; {@code ids} the rows
 * to delete.
 */
public record BulkRequest(
        String operation,
        List<JsonNode> items,
        List<Long> ids
) {
}
