package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.sql.Types;
import java.util.List;
import java.util.Set;

/**
 * A parameterized, read-only statement that reports and previews may run.
 *
 * @param sources {@code DataChangedEvent} sources whose changes make cached results stale
 */
public record NamedReportQuery(
        String name,
        String description,
        @JsonIgnore String sql,
        List<Param> parameters,
        Set<String> sources
) {

    public record Param(String name, @JsonIgnore int sqlType, Object defaultValue) {

        public static Param text(String name) {
            return new Param(name, Types.VARCHAR, null);
        }

        public static Param integer(String name, int defaultValue) {
            return new Param(name, Types.INTEGER, defaultValue);
        }
    }
}
