package com.github.dimitryivaniuta.cmdb.search;

import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.resource.ResourceQuery;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceRegistry;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import com.github.dimitryivaniuta.cmdb.support.PagingSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Free-text search over name, external id and description of every (or the selected) resource type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchService {

    static final int MIN_TERM_LENGTH = 2;

    private final ResourceServiceRegistry services;

    public List<SearchHit> search(String term, String types, String region, Integer limit) {
        if (term == null || term.trim().length() < MIN_TERM_LENGTH) {
            throw ValidationFailedException.of("q", "q must be at least " + MIN_TERM_LENGTH + " characters");
        }
        int l = PagingSupport.limit(limit);
        ResourceQuery query = new ResourceQuery(1, l, "updatedAt", "DESC", null, null, null, null, null)
                .withSearch(term.trim(), region);

        List<SearchHit> hits = new ArrayList<>();
        for (ResourceType type : parseTypes(types)) {
            PageResult<? extends NetworkResourceEntity> page = services.get(type).findAll(query);
            hits.add(new SearchHit(type.path(), page.totalCount(), page.data()));
        }
        log.debug("Search q='{}' types={} region={} -> {} types searched", term, types, region, hits.size());
        return hits;
    }

    static Set<ResourceType> parseTypes(String types) {
        if (types == null || types.isBlank()) {
            return EnumSet.allOf(ResourceType.class);
        }
        Set<ResourceType> out = EnumSet.noneOf(ResourceType.class);
        for (String t : Arrays.stream(types.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList()) {
            out.add(ResourceType.parse(t)
                    .orElseThrow(() -> ValidationFailedException.of("types", "Unknown resource type: " + t)));
        }
        return out.isEmpty() ? EnumSet.allOf(ResourceType.class) : out;
    }
}
