package com.github.dimitryivaniuta.cmdb.resource;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the service for a {@link ResourceType}; used by the search and bulk endpoints.
 */
@Component
public class ResourceServiceRegistry {

    private final Map<ResourceType, AbstractResourceService<?, ?>> services = new EnumMap<>(ResourceType.class);

    public ResourceServiceRegistry(List<AbstractResourceService<?, ?>> all) {
        for (AbstractResourceService<?, ?> s : all) {
            services.put(s.resourceType(), s);
        }
    }

    public AbstractResourceService<?, ?> get(ResourceType type) {
        AbstractResourceService<?, ?> s = services.get(type);
        if (s == null) {
            throw new IllegalStateException("No service registered for " + type);
        }
        return s;
    }

    public Collection<AbstractResourceService<?, ?>> all() {
        return services.values();
    }
}
