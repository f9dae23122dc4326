package com.github.dimitryivaniuta.cmdb.report;

import com.github.dimitryivaniuta.cmdb.cache.CacheStats;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.web.ApiResponse;
import com.github.dimitryivaniuta.cmdb.web.RequestContextKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService service;

    @GetMapping
    public ApiResponse<List<ReportDefinition>> list(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String reportType,
            @RequestParam(required = false) Boolean active) {
        PageResult<ReportDefinition> result = service.listDefinitions(page, limit,
                parse("category", category, ReportCategory::fromValue),
                parse("reportType", reportType, ReportType::fromValue),
                active);
        return ApiResponse.page(result.data(), result.toMeta());
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ReportDefinition>> create(
            @RequestBody ReportDefinitionRequest request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(service.createDefinition(request, userId), "Report created successfully"));
    }

    @GetMapping("/queries")
    public ApiResponse<Collection<NamedReportQuery>> queries() {
        return ApiResponse.ok(service.queries());
    }

    @GetMapping("/cache/stats")
    public ApiResponse<CacheStats> cacheStats() {
        return ApiResponse.ok(service.cacheStats());
    }

    @DeleteMapping("/cache")
    public ApiResponse<Map<String, Object>> invalidateCache(@RequestParam(required = false) String pattern) {
        int removed = service.invalidateCache(pattern);
        return ApiResponse.ok(Map.of("invalidated", removed));
    }

    @PostMapping("/preview")
    public ApiResponse<List<Map<String, Object>>> preview(@RequestBody PreviewRequest request) {
        PageResult<Map<String, Object>> result = service.preview(request);
        return ApiResponse.page(result.data(), result.toMeta());
    }

    @GetMapping("/executions/{executionId}")
    public ApiResponse<ReportExecution> execution(@PathVariable String executionId) {
        return ApiResponse.ok(service.getExecution(executionId));
    }

    @GetMapping("/{reportId}")
    public ApiResponse<ReportDefinition> get(@PathVariable String reportId) {
        return ApiResponse.ok(service.getDefinition(reportId));
    }

    @PutMapping("/{reportId}")
    public ApiResponse<ReportDefinition> update(
            @PathVariable String reportId,
            @RequestBody ReportDefinitionRequest request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ApiResponse.ok(service.updateDefinition(reportId, request, userId), "Report updated successfully");
    }

    @DeleteMapping("/{reportId}")
    public ApiResponse<ReportDefinition> delete(
            @PathVariable String reportId,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ApiResponse.ok(service.deactivateDefinition(reportId, userId), "Report deactivated");
    }

    @PostMapping("/{reportId}/run")
    public ApiResponse<ReportRunResult> run(
            @PathVariable String reportId,
            @RequestBody(required = false) ReportRunRequest request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ApiResponse.ok(service.runReport(reportId, request, userId));
    }

    @GetMapping("/{reportId}/executions")
    public ApiResponse<List<ReportExecution>> executions(
            @PathVariable String reportId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        PageResult<ReportExecution> result = service.executionHistory(reportId, page, limit);
        return ApiResponse.page(result.data(), result.toMeta());
    }

    private static <T> T parse(String field, String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException ex) {
            throw ValidationFailedException.of(field, ex.getMessage());
        }
    }
}
