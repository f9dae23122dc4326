package com.github.dimitryivaniuta.cmdb.resource;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ResourceSpecifications {
    private ResourceSpecifications() {}

    public static <E extends NetworkResourceEntity> Specification<E> matching(ResourceQuery q) {
        return (root, query, cb) -> {
            List<Predicate> p = new ArrayList<>();
            p.add(cb.isNull(root.get("deletedAt")));

            if (hasText(q.region())) p.add(cb.equal(root.get("region"), q.region().trim()));
            if (hasText(q.state())) p.add(cb.equal(root.get("state"), q.state().trim()));
            if (hasText(q.environment())) p.add(cb.equal(root.get("environment"), q.environment().trim()));
            if (hasText(q.owner())) p.add(cb.equal(root.get("owner"), q.owner().trim()));

            if (hasText(q.search())) {
                String like = "%" + escape(q.search().trim().toLowerCase(Locale.ROOT)) + "%";
                p.add(cb.or(
                        cb.like(cb.lower(root.get("name")), like, '\\'),
                        cb.like(cb.lower(root.get("externalId")), like, '\\'),
                        cb.like(cb.lower(root.get("description")), like, '\\')
                ));
            }
            return cb.and(p.toArray(new Predicate[0]));
        };
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
