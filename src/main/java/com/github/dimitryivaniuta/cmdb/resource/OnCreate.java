package com.github.dimitryivaniuta.cmdb.resource;

/**
 * Validation group for constraints that only apply when a resource is first registered
 * (required identifiers). Updates are partial and validated with the default group only.
 */
public interface OnCreate {
}
