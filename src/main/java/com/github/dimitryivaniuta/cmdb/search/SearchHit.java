package com.github.dimitryivaniuta.cmdb.search;

import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;

import java.util.List;

/**
 * Matches for one resource type; {@code items} holds at most the requested limit.
 */
public record SearchHit(
        String resourceType,
        long totalCount,
        List<? extends NetworkResourceEntity> items
) {
}
