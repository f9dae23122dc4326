package com.github.dimitryivaniuta.cmdb.resource;

/**
 * List parameters bound from the query string. Paging values are clamped by the service.
 */
public record ResourceQuery(
        Integer page,
        Integer limit,
        String sortBy,
        String sortOrder,
        String region,
        String state,
        String environment,
        String owner,
        String search
) {

    public static ResourceQuery firstPage(int limit) {
        return new ResourceQuery(1, limit, null, null, null, null, null, null, null);
    }

    public ResourceQuery withSearch(String term, String region) {
        return new ResourceQuery(page, limit, sortBy, sortOrder, region, state, environment, owner, term);
    }
}
