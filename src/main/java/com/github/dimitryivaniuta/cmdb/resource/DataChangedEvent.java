package com.github.dimitryivaniuta.cmdb.resource;

/**
 * Published after a mutation that can make cached report results stale.
 *
 * @param source resource type name ({@code VPC}, ...) or {@code WORKFLOW}
 */
public record DataChangedEvent(String source, String entityId, String operation) {
}
