package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.cmdb.error.ResourceNotFoundException;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxPublisher;
import com.github.dimitryivaniuta.cmdb.resource.DataChangedEvent;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.scheduler.JobLock;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingInProgressException;
import com.github.dimitryivaniuta.cmdb.scheduler.PollingService;
import com.github.dimitryivaniuta.cmdb.scheduler.SchedulerProperties;
import com.github.dimitryivaniuta.cmdb.support.PagingSupport;
import com.github.dimitryivaniuta.cmdb.workflow.DiscoveryResult.DiscoveryError;
import com.github.dimitryivaniuta.cmdb.workflow.PollingResult.PollingError;
import com.github.dimitryivaniuta.cmdb.workflow.client.N8nApiClient;
import com.github.dimitryivaniuta.cmdb.workflow.client.N8nClientException;
import com.github.dimitryivaniuta.cmdb.workflow.client.N8nProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry and execution tracking for workflows running on the n8n engine.
 * <p>
 * Remote calls fail with {@link N8nClientException}. Multi-item operations (discovery, polling)
 * keep going past per-item failures and report them in their result.
 */
@Slf4j
@Service
public class N8nWorkflowService {

    private static final int STATUS_PAGE_LIMIT = 50;
    private static final int ORPHAN_SCAN_LIMIT = 1_000;
    private static final int TOP_ERRORS = 5;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final N8nApiClient client;
    private final WorkflowRegistryRepository registry;
    private final WorkflowExecutionRepository executions;
    private final WorkflowAlertService alerts;
    private final OutboxPublisher outbox;
    private final ApplicationEventPublisher events;
    private final Executor pollExecutor;
    private final JobLock jobLock;
    private final SchedulerProperties schedulerProps;
    private final N8nProperties n8nProps;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final TransactionTemplate tx;

    public N8nWorkflowService(N8nApiClient client,
                              WorkflowRegistryRepository registry,
                              WorkflowExecutionRepository executions,
                              WorkflowAlertService alerts,
                              OutboxPublisher outbox,
                              ApplicationEventPublisher events,
                              @Qualifier("workflowPollExecutor") Executor pollExecutor,
                              JobLock jobLock,
                              SchedulerProperties schedulerProps,
                              N8nProperties n8nProps,
                              ObjectMapper mapper,
                              Clock clock,
                              PlatformTransactionManager txManager) {
        this.client = client;
        this.registry = registry;
        this.executions = executions;
        this.alerts = alerts;
        this.outbox = outbox;
        this.events = events;
        this.pollExecutor = pollExecutor;
        this.jobLock = jobLock;
        this.schedulerProps = schedulerProps;
        this.n8nProps = n8nProps;
        this.mapper = mapper;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ---------------------------------------------------------------- discovery

    public DiscoveryResult discoverWorkflows(DiscoveryOptions options) {
        DiscoveryOptions opts = options == null ? DiscoveryOptions.defaults() : options;
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("active", opts.active());
        query.put("limit", opts.effectiveLimit());

        JsonNode remote = client.get("/workflows", query).path("data");
        List<WorkflowRegistryEntry> registered = new ArrayList<>();
        List<DiscoveryError> errors = new ArrayList<>();
        int discovered = 0;
        for (JsonNode workflow : remote) {
            discovered++;
            String workflowId = workflow.path("id").asText();
            try {
                registered.add(register(workflow, opts.provider()));
            } catch (DataAccessException ex) {
                log.error("Failed to register workflow {}", workflowId, ex);
                errors.add(new DiscoveryError(workflowId, ex.getMostSpecificCause().getMessage()));
            }
        }

        log.info("Workflow discovery: discovered={} registered={} failed={}", discovered, registered.size(), errors.size());
        if (!registered.isEmpty()) {
            events.publishEvent(new DataChangedEvent("WORKFLOW", null, "DISCOVER"));
        }
        return new DiscoveryResult(discovered, registered.size(), registered, List.copyOf(errors));
    }

    private WorkflowRegistryEntry register(JsonNode workflow, WorkflowProvider providerOverride) {
        String workflowId = workflow.path("id").asText();
        String name = workflow.path("name").asText(workflowId);
        boolean active = workflow.path("active").asBoolean(false);
        return tx.execute(status -> registry.findByWorkflowId(workflowId)
                .map(existing -> {
                    existing.setName(name);
                    existing.setActive(active);
                    return registry.save(existing);
                })
                .orElseGet(() -> {
                    String text = WorkflowClassifier.searchText(workflow);
                    return registry.save(WorkflowRegistryEntry.builder()
                            .workflowId(workflowId)
                            .name(name)
                            .workflowType(WorkflowClassifier.inferType(text))
                            .provider(providerOverride != null ? providerOverride : WorkflowClassifier.inferProvider(text))
                            .active(active)
                            .build());
                }));
    }

    // ---------------------------------------------------------------- status & execution

    /**
     * One execution when {@code executionId} is given, otherwise the latest executions of the
     * workflow (engine payloads, without execution data).
     */
    public JsonNode getWorkflowStatus(String workflowId, String executionId) {
        if (executionId != null && !executionId.isBlank()) {
            return client.get("/executions/" + executionId);
        }
        return listRemoteExecutions(workflowId, false);
    }

    public JsonNode executeWorkflow(String workflowId, JsonNode data) {
        requireRegistered(workflowId);

        ObjectNode body = mapper.createObjectNode();
        if (data != null && !data.isNull() && !data.isMissingNode()) {
            body.set("runData", data);
        }
        JsonNode response = client.post("/workflows/" + workflowId + "/execute", body);
        RemoteExecution execution = RemoteExecution.from(response, workflowId);

        if (execution.id() == null) {
            log.warn("Workflow {} started but the engine returned no execution id", workflowId);
            return response;
        }
        try {
            outbox.publish(WorkflowExecutionRecordHandler.EVENT_TYPE, "WORKFLOW_EXECUTION", execution.id(),
                    new TriggeredExecution(workflowId, execution.id(), execution.status(), execution.startedAt(),
                            toMap(execution.data())));
        } catch (RuntimeException ex) {
            // the run is already started remotely; the next poll picks the execution up
            log.error("Workflow {} execution {} started but tracking could not be queued",
                    workflowId, execution.id(), ex);
        }
        log.info("Workflow {} triggered, execution={} status={}", workflowId, execution.id(), execution.status());
        return response;
    }

    // ---------------------------------------------------------------- polling

    public PollingResult pollWorkflowStatuses(PollingOptions options) {
        PollingOptions opts = options == null ? PollingOptions.defaults() : options;
        long started = System.nanoTime();

        List<String> targets = targets(opts);
        int batchSize = Math.max(1, Optional.ofNullable(opts.batchSize()).orElse(schedulerProps.getBatchSize()));
        int maxConcurrent = Math.max(1, Optional.ofNullable(opts.maxConcurrent()).orElse(schedulerProps.getMaxConcurrent()));

        List<PollingError> errors = new ArrayList<>();
        List<RemoteExecution> fetched = new ArrayList<>();
        int polled = 0;

        for (int i = 0; i < targets.size(); i += batchSize) {
            List<String> batch = targets.subList(i, Math.min(i + batchSize, targets.size()));
            for (FetchOutcome outcome : fetchBatch(batch, maxConcurrent)) {
                if (outcome.error() != null) {
                    errors.add(new PollingError(outcome.workflowId(), null, outcome.error(), PollingError.WORKFLOW_POLL));
                } else {
                    polled++;
                    fetched.addAll(outcome.executions());
                }
            }
            if (i + batchSize < targets.size()) {
                pauseBetweenBatches();
            }
        }

        int updated = 0;
        List<ExecutionChange> changes = new ArrayList<>();
        for (RemoteExecution remote : fetched) {
            try {
                ExecutionChange change = upsertExecution(remote);
                updated++;
                if (change.alert() != null) {
                    changes.add(change);
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to store execution {} of workflow {}: {}", remote.id(), remote.workflowId(), ex.toString());
                errors.add(new PollingError(remote.workflowId(), remote.id(), ex.getMessage(), PollingError.EXECUTION_UPDATE));
            }
        }

        int triggered = 0;
        if (!opts.skipAlerts()) {
            for (ExecutionChange change : changes) {
                try {
                    if (alerts.raise(change.executionId(), change.alert(), WorkflowAlertService.DEFAULT_RECIPIENTS)) {
                        triggered++;
                    }
                } catch (RuntimeException ex) {
                    log.warn("Failed to raise {} alert for execution {}: {}", change.alert().value(), change.executionId(), ex.toString());
                    errors.add(new PollingError(change.workflowId(), change.executionId(), ex.getMessage(), PollingError.ALERT_TRIGGER));
                }
            }
        }

        if (updated > 0) {
            events.publishEvent(new DataChangedEvent("WORKFLOW", null, "POLL"));
        }
        long durationMs = (System.nanoTime() - started) / 1_000_000;
        PollingResult result = new PollingResult(targets.size(), polled, updated, triggered, List.copyOf(errors), durationMs);
        log.info("Workflow poll: workflows={} polled={} executions={} alerts={} errors={} in {}ms",
                result.totalWorkflows(), polled, updated, triggered, result.errors().size(), durationMs);
        return result;
    }

    private List<String> targets(PollingOptions opts) {
        if (!opts.workflowIds().isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(opts.workflowIds()));
        }
        List<WorkflowRegistryEntry> entries = opts.includeInactive()
                ? registry.findAllByOrderByWorkflowIdAsc()
                : registry.findByActiveTrueOrderByWorkflowIdAsc();
        return entries.stream().map(WorkflowRegistryEntry::getWorkflowId).toList();
    }

    /** Fetches the batch in groups of at most {@code maxConcurrent} parallel requests. */
    private List<FetchOutcome> fetchBatch(List<String> batch, int maxConcurrent) {
        List<FetchOutcome> outcomes = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i += maxConcurrent) {
            List<CompletableFuture<FetchOutcome>> group = batch.subList(i, Math.min(i + maxConcurrent, batch.size()))
                    .stream()
                    .map(id -> CompletableFuture.supplyAsync(() -> fetch(id), pollExecutor))
                    .toList();
            group.forEach(f -> outcomes.add(f.join()));
        }
        return outcomes;
    }

    private FetchOutcome fetch(String workflowId) {
        try {
            List<RemoteExecution> list = new ArrayList<>();
            for (JsonNode node : listRemoteExecutions(workflowId, true)) {
                RemoteExecution remote = RemoteExecution.from(node, workflowId);
                if (remote.id() != null) {
                    list.add(remote);
                }
            }
            return new FetchOutcome(workflowId, list, null);
        } catch (N8nClientException ex) {
            log.warn("Polling workflow {} failed [{}]: {}", workflowId, ex.getCode(), ex.getMessage());
            return new FetchOutcome(workflowId, List.of(), ex.getCode() + ": " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Polling workflow {} failed", workflowId, ex);
            return new FetchOutcome(workflowId, List.of(), ex.toString());
        }
    }

    private JsonNode listRemoteExecutions(String workflowId, boolean includeData) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("workflowId", workflowId);
        query.put("limit", STATUS_PAGE_LIMIT);
        query.put("includeData", includeData);
        return client.get("/executions", query).path("data");
    }

    private ExecutionChange upsertExecution(RemoteExecution remote) {
        return tx.execute(status -> {
            Optional<WorkflowExecution> existing = executions.findByExecutionId(remote.id());
            ExecutionStatus previous = existing.map(WorkflowExecution::getStatus).orElse(null);
            ExecutionStatus current = remote.localStatus();
            String errorMessage = remote.errorMessage();

            WorkflowExecution e = existing.orElseGet(() -> WorkflowExecution.builder().executionId(remote.id()).build());
            e.setWorkflowId(remote.workflowId());
            e.setStatus(current);
            if (remote.startedAt() != null) {
                e.setStartTime(remote.startedAt());
            } else if (e.getStartTime() == null) {
                e.setStartTime(clock.instant());
            }
            e.setEndTime(remote.stoppedAt());
            e.setDurationMs(remote.durationMs());
            e.setErrorMessage(errorMessage);
            e.setResourcesFailed(current == ExecutionStatus.FAILURE ? 1 : 0);
            if (remote.data() != null && remote.data().isObject()) {
                e.setExecutionData(toMap(remote.data()));
            }
            executions.save(e);

            AlertType alert = alertFor(previous, current, existing.isEmpty(), errorMessage);
            return new ExecutionChange(remote.workflowId(), remote.id(), alert);
        });
    }

    /**
     * failure: a new execution, or a known one moving into failure, that failed with an error message.
     * success: a known execution recovering from failure.
     */
    static AlertType alertFor(ExecutionStatus previous, ExecutionStatus current, boolean created, String errorMessage) {
        if (current == ExecutionStatus.FAILURE) {
            return errorMessage != null && (created || previous != ExecutionStatus.FAILURE) ? AlertType.FAILURE : null;
        }
        if (created || previous == current) {
            return null;
        }
        if (current == ExecutionStatus.SUCCESS && previous == ExecutionStatus.FAILURE) {
            return AlertType.SUCCESS;
        }
        return null;
    }

    private void pauseBetweenBatches() {
        long delay = n8nProps.getPoll().getBatchDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between poll batches", e);
        }
    }

    // ---------------------------------------------------------------- sync

    /**
     * Discovery, then polling, then orphan cleanup. When executions are synced the whole run holds
     * the polling lock.
     *
     * @throws PollingInProgressException when executions are to be synced and a poll holds the lock
     */
    public SyncResult syncWorkflowData(SyncOptions options) {
        SyncOptions opts = options == null ? new SyncOptions(false, true, false, List.of()) : options;
        boolean polls = opts.shouldSyncExecutions();
        if (polls && !jobLock.acquireLock(PollingService.LOCK_NAME, schedulerProps.getLockTimeout())) {
            throw new PollingInProgressException("A workflow poll is already in progress");
        }
        try {
            return sync(opts, polls);
        } finally {
            if (polls) {
                jobLock.releaseLock(PollingService.LOCK_NAME);
            }
        }
    }

    private SyncResult sync(SyncOptions opts, boolean polls) {
        DiscoveryResult discovery = discoverWorkflows(
                new DiscoveryOptions(opts.fullSync() ? null : Boolean.TRUE, DiscoveryOptions.DEFAULT_LIMIT, null));

        PollingResult polling = null;
        if (polls) {
            polling = pollWorkflowStatuses(new PollingOptions(
                    opts.workflowIds(), opts.fullSync(), null, null, false));
        }

        int orphans = opts.cleanupOrphaned() ? cleanupOrphanedRecords() : 0;

        SyncResult result = new SyncResult(discovery.registered(),
                polling == null ? 0 : polling.updatedExecutions(), orphans, polling);
        log.info("Workflow sync: workflows={} executions={} orphansRemoved={}",
                result.workflows(), result.executions(), orphans);
        return result;
    }

    /** Deletes registry rows, and their executions, for workflows no longer present on the engine. */
    int cleanupOrphanedRecords() {
        JsonNode remote = client.get("/workflows", Map.of("limit", ORPHAN_SCAN_LIMIT)).path("data");
        Set<String> remoteIds = new HashSet<>();
        remote.forEach(w -> remoteIds.add(w.path("id").asText()));

        List<WorkflowRegistryEntry> orphaned = registry.findAllByOrderByWorkflowIdAsc().stream()
                .filter(w -> !remoteIds.contains(w.getWorkflowId()))
                .toList();
        for (WorkflowRegistryEntry entry : orphaned) {
            tx.executeWithoutResult(status -> {
                executions.deleteByWorkflowId(entry.getWorkflowId());
                registry.deleteById(entry.getId());
            });
        }
        if (!orphaned.isEmpty()) {
            log.info("Removed {} orphaned workflows: {}", orphaned.size(),
                    orphaned.stream().map(WorkflowRegistryEntry::getWorkflowId).toList());
            events.publishEvent(new DataChangedEvent("WORKFLOW", null, "CLEANUP"));
        }
        return orphaned.size();
    }

    // ---------------------------------------------------------------- local queries

    @Transactional(readOnly = true)
    public PageResult<WorkflowRegistryEntry> listWorkflows(Integer page, Integer limit,
                                                           WorkflowProvider provider, WorkflowType type, Boolean active) {
        int p = PagingSupport.page(page);
        int l = PagingSupport.limit(limit);
        Page<WorkflowRegistryEntry> result = registry.search(provider, type, active,
                PageRequest.of(p - 1, l, Sort.by("workflowId")));
        return PageResult.of(result.getContent(), result.getTotalElements(), p, l);
    }

    @Transactional(readOnly = true)
    public ExecutionHistory getExecutionHistory(String workflowId, Integer limit, Integer offset) {
        int l = PagingSupport.clampInt(limit, STATUS_PAGE_LIMIT, 1, 500);
        int o = PagingSupport.clampInt(offset, 0, 0, Integer.MAX_VALUE);
        return new ExecutionHistory(executions.findHistory(workflowId, l, o), executions.countByWorkflowId(workflowId), l, o);
    }

    @Transactional(readOnly = true)
    public WorkflowStats getWorkflowStats(String workflowId) {
        WorkflowRegistryEntry workflow = requireRegistered(workflowId);
        List<WorkflowExecution> all = executions.findByWorkflowIdOrderByStartTimeDesc(workflowId);

        long total = all.size();
        long succeeded = all.stream().filter(e -> e.getStatus() == ExecutionStatus.SUCCESS).count();
        long failed = all.stream().filter(e -> e.getStatus() == ExecutionStatus.FAILURE).count();
        double avg = all.stream()
                .map(WorkflowExecution::getDurationMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0);

        List<WorkflowStats.ErrorCount> topErrors = all.stream()
                .map(WorkflowExecution::getErrorMessage)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_ERRORS)
                .map(en -> new WorkflowStats.ErrorCount(en.getKey(), en.getValue()))
                .toList();

        return new WorkflowStats(
                workflowId,
                workflow.getName(),
                total,
                succeeded,
                failed,
                avg,
                all.isEmpty() ? null : all.get(0).getStartTime(),
                lastStart(all, ExecutionStatus.SUCCESS),
                lastStart(all, ExecutionStatus.FAILURE),
                total == 0 ? 0 : (failed * 100.0) / total,
                topErrors);
    }

    public boolean healthCheck() {
        return client.healthCheck();
    }

    private WorkflowRegistryEntry requireRegistered(String workflowId) {
        return registry.findByWorkflowId(workflowId)
                .orElseThrow(() -> new ResourceNotFoundException("WORKFLOW_NOT_FOUND",
                        "Workflow " + workflowId + " not found in registry"));
    }

    private static Instant lastStart(List<WorkflowExecution> newestFirst, ExecutionStatus status) {
        return newestFirst.stream()
                .filter(e -> e.getStatus() == status)
                .map(WorkflowExecution::getStartTime)
                .findFirst()
                .orElse(null);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private record FetchOutcome(String workflowId, List<RemoteExecution> executions, String error) {
    }

    private record ExecutionChange(String workflowId, String executionId, AlertType alert) {
    }
}
