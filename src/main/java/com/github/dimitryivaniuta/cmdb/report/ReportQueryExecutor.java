package com.github.dimitryivaniuta.cmdb.report;

import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.error.DatabaseErrorTranslator;
import com.github.dimitryivaniuta.cmdb.error.DatabaseOperationException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.support.PagingSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs catalog queries with the {@link QueryOptions} bag: cache lookup first, then the database
 * with a statement timeout and row cap.
 */
@Slf4j
@Component
public class ReportQueryExecutor {

    private static final String STATEMENT_CANCELED = "57014";

    private final DataSource dataSource;
    private final ReportQueryCatalog catalog;
    private final ReportCache cache;
    private final ReportProperties props;
    private final CmdbMetrics metrics;

    public ReportQueryExecutor(DataSource dataSource,
                               ReportQueryCatalog catalog,
                               ReportCache cache,
                               ReportProperties props,
                               CmdbMetrics metrics) {
        this.dataSource = dataSource;
        this.catalog = catalog;
        this.cache = cache;
        this.props = props;
        this.metrics = metrics;
    }

    public QueryResult execute(String queryName, Map<String, Object> params, QueryOptions options) {
        NamedReportQuery query = catalog.require(queryName);
        QueryOptions opts = options == null ? QueryOptions.defaults() : options;
        Map<String, Object> args = resolveArguments(query, params);

        boolean cached = useCache(opts);
        String key = cached ? cache.key(queryName, args) : null;
        if (cached) {
            Optional<Object> hit = cache.get(key);
            if (hit.isPresent()) {
                metrics.cacheHit(queryName);
                @SuppressWarnings("unchecked")
                List<Map<String, Object>> rows = (List<Map<String, Object>>) hit.get();
                return new QueryResult(queryName, rows, rows.size(), true, 0);
            }
            metrics.cacheMiss(queryName);
        }

        long start = System.nanoTime();
        List<Map<String, Object>> rows = Collections.unmodifiableList(
                run(query, query.sql(), bind(query, args), opts));
        long nanos = System.nanoTime() - start;
        metrics.recordDuration("cmdb_report_query_duration", queryName, nanos);

        if (cached) {
            cache.set(key, rows, opts.cacheTtl());
        }
        log.debug("Report query {} returned {} rows in {} ms", queryName, rows.size(), Duration.ofNanos(nanos).toMillis());
        return new QueryResult(queryName, rows, rows.size(), false, Duration.ofNanos(nanos).toMillis());
    }

    /**
     * Same query wrapped with {@code LIMIT/OFFSET}; {@code page} starts at 1 and {@code limit} is
     * clamped to [1, 100].
     */
    public PageResult<Map<String, Object>> executePage(String queryName, Map<String, Object> params,
                                                       Integer page, Integer limit, QueryOptions options) {
        NamedReportQuery query = catalog.require(queryName);
        QueryOptions opts = options == null ? QueryOptions.defaults() : options;
        int p = PagingSupport.page(page);
        int l = PagingSupport.limit(limit);
        Map<String, Object> args = resolveArguments(query, params);

        boolean cached = useCache(opts);
        String key = null;
        if (cached) {
            Map<String, Object> keyArgs = new TreeMap<>(args);
            keyArgs.put("$page", p);
            keyArgs.put("$limit", l);
            key = cache.key(queryName, keyArgs);
            Optional<Object> hit = cache.get(key);
            if (hit.isPresent()) {
                metrics.cacheHit(queryName);
                @SuppressWarnings("unchecked")
                PageResult<Map<String, Object>> result = (PageResult<Map<String, Object>>) hit.get();
                return result;
            }
            metrics.cacheMiss(queryName);
        }

        MapSqlParameterSource source = bind(query, args);
        Long total = count(query, source, opts);

        source.addValue("pageLimit", l, Types.INTEGER);
        source.addValue("pageOffset", PagingSupport.offset(p, l), Types.BIGINT);
        String pageSql = "SELECT * FROM (" + query.sql() + ") q LIMIT :pageLimit OFFSET :pageOffset";
        List<Map<String, Object>> rows = run(query, pageSql, source, opts);

        PageResult<Map<String, Object>> result = PageResult.of(Collections.unmodifiableList(rows),
                total == null ? 0 : total, p, l);
        if (cached) {
            cache.set(key, result, opts.cacheTtl());
        }
        return result;
    }

    private Long count(NamedReportQuery query, MapSqlParameterSource source, QueryOptions opts) {
        NamedParameterJdbcTemplate template = template(opts, false);
        try {
            return template.queryForObject("SELECT COUNT(*) FROM (" + query.sql() + ") q", source, Long.class);
        } catch (DataAccessException ex) {
            throw translate(query, opts, ex);
        }
    }

    private List<Map<String, Object>> run(NamedReportQuery query, String sql, MapSqlParameterSource source, QueryOptions opts) {
        NamedParameterJdbcTemplate template = template(opts, true);
        try {
            return template.queryForList(sql, source);
        } catch (DataAccessException ex) {
            throw translate(query, opts, ex);
        }
    }

    private RuntimeException translate(NamedReportQuery query, QueryOptions opts, DataAccessException ex) {
        if (ex instanceof QueryTimeoutException || STATEMENT_CANCELED.equals(DatabaseErrorTranslator.sqlState(ex))) {
            log.warn("Report query {} timed out after {}", query.name(), timeout(opts));
            return new DatabaseOperationException(HttpStatus.SERVICE_UNAVAILABLE, DatabaseOperationException.QUERY_TIMEOUT,
                    "Query " + query.name() + " exceeded its timeout of " + timeout(opts).toSeconds() + "s", ex);
        }
        log.error("Report query {} failed", query.name(), ex);
        return DatabaseErrorTranslator.translate(ex);
    }

    private NamedParameterJdbcTemplate template(QueryOptions opts, boolean capRows) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout((int) Math.max(1, Math.ceil(timeout(opts).toMillis() / 1000.0)));
        if (capRows) {
            jdbc.setMaxRows(opts.maxRows() != null ? opts.maxRows() : props.getMaxRows());
        }
        return new NamedParameterJdbcTemplate(jdbc);
    }

    private Duration timeout(QueryOptions opts) {
        return opts.timeout() != null ? opts.timeout() : props.getQueryTimeout();
    }

    private boolean useCache(QueryOptions opts) {
        return props.getCache().isEnabled() && opts.cacheEnabled();
    }

    /** Declared parameters only, with defaults applied; sorted so cache keys are stable. */
    Map<String, Object> resolveArguments(NamedReportQuery query, Map<String, Object> params) {
        Map<String, Object> given = params == null ? Map.of() : params;
        List<ErrorDetail> errors = new ArrayList<>();
        for (String name : given.keySet()) {
            if (query.parameters().stream().noneMatch(p -> p.name().equals(name))) {
                errors.add(new ErrorDetail(ValidationFailedException.CODE,
                        "Query " + query.name() + " does not accept parameter '" + name + "'", name));
            }
        }

        Map<String, Object> args = new TreeMap<>();
        for (NamedReportQuery.Param p : query.parameters()) {
            Object raw = given.get(p.name());
            try {
                args.put(p.name(), coerce(p, raw == null ? p.defaultValue() : raw));
            } catch (NumberFormatException ex) {
                errors.add(new ErrorDetail(ValidationFailedException.CODE,
                        "Parameter '" + p.name() + "' must be an integer", p.name()));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationFailedException(errors);
        }
        return args;
    }

    private static Object coerce(NamedReportQuery.Param p, Object value) {
        if (value == null) {
            return null;
        }
        if (p.sqlType() == Types.INTEGER) {
            return value instanceof Number n ? n.intValue() : Integer.parseInt(value.toString().trim());
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static MapSqlParameterSource bind(NamedReportQuery query, Map<String, Object> args) {
        MapSqlParameterSource source = new MapSqlParameterSource();
        for (NamedReportQuery.Param p : query.parameters()) {
            source.addValue(p.name(), args.get(p.name()), p.sqlType());
        }
        return source;
    }
}
