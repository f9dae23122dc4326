package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.audit.AuditTrail;
import com.github.dimitryivaniuta.cmdb.cache.CacheStats;
import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.CmdbException;
import com.github.dimitryivaniuta.cmdb.error.DatabaseOperationException;
import com.github.dimitryivaniuta.cmdb.error.DuplicateResourceException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ResourceNotFoundException;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.support.PagingSupport;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.groups.Default;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

/**
 * Report definitions and their runs.
 * <p>
 * A run moves its {@link ReportExecution} through pending, running and one of completed, failed or
 * timeout. Each transition is saved on its own so a failed run still leaves its record behind.
 */
@Slf4j
@Service
public class ReportService {

    public static final String DEFINITIONS_CACHE = "reportDefinitions:ttl=60";
    public static final String NOT_FOUND_CODE = "REPORT_NOT_FOUND";
    public static final String EXECUTION_NOT_FOUND_CODE = "REPORT_EXECUTION_NOT_FOUND";
    public static final String DUPLICATE_CODE = "DUPLICATE_REPORT";

    private static final String AUDIT_TYPE = "REPORT";

    private final ReportDefinitionRepository definitions;
    private final ReportExecutionRepository executions;
    private final ReportQueryExecutor executor;
    private final ReportQueryCatalog catalog;
    private final ReportCache cache;
    private final ReportProperties props;
    private final AuditTrail audit;
    private final Validator validator;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ReportService(ReportDefinitionRepository definitions,
                         ReportExecutionRepository executions,
                         ReportQueryExecutor executor,
                         ReportQueryCatalog catalog,
                         ReportCache cache,
                         ReportProperties props,
                         AuditTrail audit,
                         Validator validator,
                         ObjectMapper mapper,
                         Clock clock) {
        this.definitions = definitions;
        this.executions = executions;
        this.executor = executor;
        this.catalog = catalog;
        this.cache = cache;
        this.props = props;
        this.audit = audit;
        this.validator = validator;
        this.mapper = mapper;
        this.clock = clock;
    }

    // ---- definitions ----

    @Transactional(readOnly = true)
    public PageResult<ReportDefinition> listDefinitions(Integer page, Integer limit,
                                                        ReportCategory category, ReportType type, Boolean active) {
        int p = PagingSupport.page(page);
        int l = PagingSupport.limit(limit);
        Page<ReportDefinition> result = definitions.search(category, type, active,
                PageRequest.of(p - 1, l, Sort.by(Sort.Direction.ASC, "name").and(Sort.by("id"))));
        return PageResult.of(result.getContent(), result.getTotalElements(), p, l);
    }

    @Cacheable(cacheNames = DEFINITIONS_CACHE, key = "#reportId")
    @Transactional(readOnly = true)
    public ReportDefinition getDefinition(String reportId) {
        return requireDefinition(reportId);
    }

    @Transactional
    public ReportDefinition createDefinition(ReportDefinitionRequest request, String userId) {
        validate(request, Default.class, OnCreate.class);

        String reportId = request.getReportId() != null ? request.getReportId() : UUID.randomUUID().toString();
        if (definitions.existsByReportId(reportId)) {
            throw new DuplicateResourceException(DUPLICATE_CODE, "Report " + reportId + " already exists", "reportId");
        }

        ReportDefinition def = ReportDefinition.builder()
                .reportId(reportId)
                .provider(CloudProvider.ALL)
                .active(true)
                .createdBy(userId)
                .version(1)
                .build();
        apply(request, def);
        def.setLastModifiedBy(userId);
        checkRules(def);

        ReportDefinition saved = definitions.save(def);
        audit.logOperation("CREATE", AUDIT_TYPE, saved.getReportId(), userId,
                Map.of("reportType", saved.getReportType().value(), "queryName", saved.getQueryConfig().queryName()));
        return saved;
    }

    @CacheEvict(cacheNames = DEFINITIONS_CACHE, key = "#reportId")
    @Transactional
    public ReportDefinition updateDefinition(String reportId, ReportDefinitionRequest request, String userId) {
        validate(request, Default.class);
        if (request.getReportId() != null && !request.getReportId().equals(reportId)) {
            throw ValidationFailedException.of("reportId", "reportId cannot be changed");
        }
        ReportDefinition def = requireDefinition(reportId);
        apply(request, def);
        def.setLastModifiedBy(userId);
        def.setVersion(def.getVersion() + 1);
        checkRules(def);

        ReportDefinition saved = definitions.save(def);
        audit.logOperation("UPDATE", AUDIT_TYPE, saved.getReportId(), userId, Map.of("version", saved.getVersion()));
        return saved;
    }

    /** Soft delete: the definition stays, with its history, but can no longer run. */
    @CacheEvict(cacheNames = DEFINITIONS_CACHE, key = "#reportId")
    @Transactional
    public ReportDefinition deactivateDefinition(String reportId, String userId) {
        ReportDefinition def = requireDefinition(reportId);
        def.setActive(false);
        def.setLastModifiedBy(userId);
        ReportDefinition saved = definitions.save(def);
        audit.logOperation("DELETE", AUDIT_TYPE, saved.getReportId(), userId, Map.of("version", saved.getVersion()));
        return saved;
    }

    // ---- runs ----

    public ReportRunResult runReport(String reportId, ReportRunRequest request, String userId) {
        ReportDefinition def = requireDefinition(reportId);
        if (!def.isActive()) {
            throw new BusinessRuleException(List.of(
                    ErrorDetail.of("REPORT_INACTIVE", "Report " + reportId + " is not active")));
        }
        ReportRunRequest req = request == null ? new ReportRunRequest(null, null, null) : request;

        QueryConfig qc = def.getQueryConfig();
        Map<String, Object> params = new LinkedHashMap<>();
        if (qc.parameters() != null) params.putAll(qc.parameters());
        if (req.parameters() != null) params.putAll(req.parameters());

        Instant start = clock.instant();
        ReportExecution exec = executions.save(ReportExecution.builder()
                .executionId(UUID.randomUUID().toString())
                .reportId(reportId)
                .status(ReportExecutionStatus.PENDING)
                .triggerType(req.triggerType() != null ? req.triggerType() : TriggerType.MANUAL)
                .startedBy(userId)
                .startTime(start)
                .executionParameters(params)
                .retentionUntil(start.plus(props.getRetention()))
                .build());

        exec.setStatus(ReportExecutionStatus.RUNNING);
        exec = executions.save(exec);

        QueryOptions options = new QueryOptions(
                req.useCache(),
                qc.cacheTtlSeconds() == null ? null : Duration.ofSeconds(qc.cacheTtlSeconds()),
                null,
                qc.maxRows());
        try {
            QueryResult result = executor.execute(qc.queryName(), params, options);
            finish(exec, ReportExecutionStatus.COMPLETED);
            exec.setRecordsProcessed((long) result.rowCount());
            exec.setOutputSizeBytes(sizeOf(result.rows()));
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("queryName", result.queryName());
            summary.put("rowCount", result.rowCount());
            summary.put("fromCache", result.fromCache());
            summary.put("queryTimeMs", result.executionTimeMs());
            exec.setResultSummary(summary);
            exec = executions.save(exec);
            log.info("Report {} completed: execution={} rows={} durationMs={}",
                    reportId, exec.getExecutionId(), result.rowCount(), exec.getDurationMs());

            int cap = props.getResultPreviewRows();
            boolean truncated = result.rows().size() > cap;
            List<Map<String, Object>> rows = truncated ? result.rows().subList(0, cap) : result.rows();
            return new ReportRunResult(exec, rows, truncated);
        } catch (CmdbException ex) {
            boolean timedOut = DatabaseOperationException.QUERY_TIMEOUT.equals(ex.getCode());
            finish(exec, timedOut ? ReportExecutionStatus.TIMEOUT : ReportExecutionStatus.FAILED);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("code", ex.getCode());
            details.put("message", ex.getMessage());
            exec.setErrorDetails(details);
            executions.save(exec);
            log.warn("Report {} {}: execution={} code={}", reportId, exec.getStatus().value(),
                    exec.getExecutionId(), ex.getCode());
            throw ex;
        }
    }

    public PageResult<Map<String, Object>> preview(PreviewRequest request) {
        validate(request, Default.class);
        return executor.executePage(request.queryName(), request.parameters(), request.page(), request.limit(),
                QueryOptions.defaults());
    }

    @Transactional(readOnly = true)
    public PageResult<ReportExecution> executionHistory(String reportId, Integer page, Integer limit) {
        requireDefinition(reportId);
        int p = PagingSupport.page(page);
        int l = PagingSupport.limit(limit);
        Page<ReportExecution> result = executions.findByReportIdOrderByStartTimeDesc(reportId, PageRequest.of(p - 1, l));
        return PageResult.of(result.getContent(), result.getTotalElements(), p, l);
    }

    @Transactional(readOnly = true)
    public ReportExecution getExecution(String executionId) {
        return executions.findByExecutionId(executionId)
                .orElseThrow(() -> new ResourceNotFoundException(EXECUTION_NOT_FOUND_CODE,
                        "Report execution " + executionId + " not found"));
    }

    @Transactional
    public int purgeExpiredExecutions() {
        return executions.deleteExpired(clock.instant());
    }

    // ---- catalog & cache ----

    public Collection<NamedReportQuery> queries() {
        return catalog.all();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    public int invalidateCache(String pattern) {
        String p = (pattern == null || pattern.isBlank()) ? ReportCache.KEY_PREFIX + "*" : pattern.trim();
        int removed = cache.invalidate(p);
        log.info("Report cache invalidated pattern={} removed={}", p, removed);
        return removed;
    }

    // ---- internals ----

    private ReportDefinition requireDefinition(String reportId) {
        return definitions.findByReportId(reportId)
                .orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_CODE, "Report " + reportId + " not found"));
    }

    private void finish(ReportExecution exec, ReportExecutionStatus status) {
        Instant end = clock.instant();
        exec.setStatus(status);
        exec.setEndTime(end);
        exec.setDurationMs(Duration.between(exec.getStartTime(), end).toMillis());
    }

    private long sizeOf(List<Map<String, Object>> rows) {
        try {
            return mapper.writeValueAsBytes(rows).length;
        } catch (JsonProcessingException e) {
            log.warn("Could not measure report output size: {}", e.getOriginalMessage());
            return -1;
        }
    }

    private static void apply(ReportDefinitionRequest r, ReportDefinition def) {
        if (r.getName() != null) def.setName(r.getName());
        if (r.getDescription() != null) def.setDescription(r.getDescription());
        if (r.getReportType() != null) def.setReportType(r.getReportType());
        if (r.getCategory() != null) def.setCategory(r.getCategory());
        if (r.getProvider() != null) def.setProvider(r.getProvider());
        if (r.getQueryConfig() != null) def.setQueryConfig(r.getQueryConfig());
        if (r.getSchedulingConfig() != null) def.setSchedulingConfig(r.getSchedulingConfig());
        if (r.getNotificationConfig() != null) def.setNotificationConfig(r.getNotificationConfig());
        if (r.getActive() != null) def.setActive(r.getActive());
        if (r.getPublicReport() != null) def.setPublicReport(r.getPublicReport());
    }

    private void checkRules(ReportDefinition def) {
        List<ErrorDetail> errors = new ArrayList<>();
        String queryName = def.getQueryConfig().queryName();
        if (!catalog.contains(queryName)) {
            errors.add(new ErrorDetail(ReportQueryCatalog.UNKNOWN_QUERY, "Unknown query '" + queryName + "'", "queryConfig.queryName"));
        } else if (def.getReportType() != ReportType.CUSTOM_QUERY
                && catalog.contains(def.getReportType().value())
                && !def.getReportType().value().equals(queryName)) {
            errors.add(new ErrorDetail("REPORT_TYPE_MISMATCH",
                    "Report type " + def.getReportType().value() + " must run query " + def.getReportType().value(),
                    "queryConfig.queryName"));
        }

        ScheduleConfig schedule = def.getSchedulingConfig();
        if (schedule != null && schedule.enabled()) {
            if (schedule.cron() == null || !CronExpression.isValidExpression(schedule.cron())) {
                errors.add(new ErrorDetail(BusinessRuleException.CODE,
                        "schedulingConfig.cron must be a six-field cron expression", "schedulingConfig.cron"));
            }
            if (schedule.timezone() != null && !ZoneId.getAvailableZoneIds().contains(schedule.timezone())) {
                errors.add(new ErrorDetail(BusinessRuleException.CODE,
                        "Unknown timezone " + schedule.timezone(), "schedulingConfig.timezone"));
            }
        }

        NotificationConfig notify = def.getNotificationConfig();
        if (notify != null && notify.enabled() && (notify.recipients() == null || notify.recipients().isEmpty())) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "notificationConfig.recipients is required when notifications are enabled", "notificationConfig.recipients"));
        }

        if (!errors.isEmpty()) {
            throw new BusinessRuleException(errors);
        }
    }

    private void validate(Object request, Class<?>... groups) {
        if (request == null) {
            throw ValidationFailedException.of(null, "Request body is required");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(request, groups);
        if (violations.isEmpty()) {
            return;
        }
        List<ErrorDetail> errors = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> new ErrorDetail(ValidationFailedException.CODE, v.getMessage(), v.getPropertyPath().toString()))
                .toList();
        throw new ValidationFailedException(errors);
    }
}
