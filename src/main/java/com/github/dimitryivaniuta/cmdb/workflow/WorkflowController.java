package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.scheduler.JobRunResult;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingConfigUpdate;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingHealth;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingService;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingStatus;
import com.github.dimitryivaniuta.cmdb.web.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Function;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/workflows")
public class WorkflowController {

    private final N8nWorkflowService workflows;
    private final PollingService polling;
    private final TriggerRateLimiter triggerLimiter;

    @GetMapping
    public ApiResponse<List<WorkflowRegistryEntry>> list(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Boolean active) {
        PageResult<WorkflowRegistryEntry> result = workflows.listWorkflows(page, limit,
                parse("provider", provider, WorkflowProvider::fromValue),
                parse("type", type, WorkflowType::fromValue),
                active);
        return ApiResponse.page(result.data(), result.toMeta());
    }

    @PostMapping("/discover")
    public ApiResponse<DiscoveryResult> discover(@RequestBody(required = false) DiscoveryOptions options) {
        DiscoveryResult result = workflows.discoverWorkflows(options == null ? DiscoveryOptions.defaults() : options);
        return ApiResponse.ok(result, "Discovered " + result.discovered() + " workflows, registered " + result.registered());
    }

    @GetMapping("/status")
    public ApiResponse<PollingStatus> schedulerStatus() {
        return ApiResponse.ok(polling.getStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<PollingHealth>> health() {
        PollingHealth health = polling.getHealth();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(ApiResponse.ok(health));
    }

    @PostMapping("/sync")
    public ApiResponse<SyncResult> sync(@RequestBody(required = false) SyncOptions options) {
        SyncOptions opts = options == null ? new SyncOptions(false, null, false, List.of()) : options;
        return ApiResponse.ok(workflows.syncWorkflowData(opts), "Workflow sync completed");
    }

    @PostMapping("/poll")
    public ApiResponse<JobRunResult> poll(@RequestBody(required = false) PollingOptions options) {
        JobRunResult result = polling.executeManual(options);
        return ApiResponse.ok(result, result.success() ? "Polling completed" : "Polling failed");
    }

    @PutMapping("/scheduler")
    public ApiResponse<PollingStatus> updateScheduler(@Valid @RequestBody PollingConfigUpdate update) {
        return ApiResponse.ok(polling.updateConfig(update), "Scheduler configuration updated");
    }

    @GetMapping("/{workflowId}/status")
    public ApiResponse<JsonNode> status(@PathVariable String workflowId,
                                        @RequestParam(required = false) String executionId) {
        return ApiResponse.ok(workflows.getWorkflowStatus(workflowId, executionId));
    }

    @PostMapping("/{workflowId}/trigger")
    public ApiResponse<JsonNode> trigger(@PathVariable String workflowId,
                                         @RequestBody(required = false) JsonNode data,
                                         HttpServletRequest request) {
        triggerLimiter.check(request);
        return ApiResponse.ok(workflows.executeWorkflow(workflowId, data), "Workflow " + workflowId + " triggered");
    }

    @GetMapping("/{workflowId}/executions")
    public ApiResponse<ExecutionHistory> executions(@PathVariable String workflowId,
                                                    @RequestParam(required = false) Integer limit,
                                                    @RequestParam(required = false) Integer offset) {
        return ApiResponse.ok(workflows.getExecutionHistory(workflowId, limit, offset));
    }

    @GetMapping("/{workflowId}/analytics")
    public ApiResponse<WorkflowStats> analytics(@PathVariable String workflowId) {
        return ApiResponse.ok(workflows.getWorkflowStats(workflowId));
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
