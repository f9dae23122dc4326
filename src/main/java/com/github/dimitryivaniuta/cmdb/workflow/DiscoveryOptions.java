package com.github.dimitryivaniuta.cmdb.workflow;

/**
 * @param active   engine-side filter; null lists active and inactive workflows
 * @param limit    page size requested from the engine, default 100
 * @param provider overrides provider inference for every discovered workflow
 */
public record DiscoveryOptions(Boolean active, Integer limit, WorkflowProvider provider) {

    public static final int DEFAULT_LIMIT = 100;

    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(null, DEFAULT_LIMIT, null);
    }

    public int effectiveLimit() {
        return limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, 1_000);
    }
}
