package com.github.dimitryivaniuta.cmdb.workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowAlertService {

    public static final String DEFAULT_RECIPIENTS = "system@networkdb";

    private final WorkflowAlertRepository repo;
    private final Clock clock;

    /**
     * Records the alert unless one of the same type already exists for the execution.
     *
     * @return true when a new alert was recorded
     */
    @Transactional
    public boolean raise(String executionId, AlertType type, String recipients) {
        boolean created = repo.insertIfAbsent(executionId, type.value(), recipients, clock.instant()) > 0;
        if (created) {
            if (type == AlertType.FAILURE) {
                log.warn("Workflow alert {} raised for execution {} -> {}", type.value(), executionId, recipients);
            } else {
                log.info("Workflow alert {} raised for execution {} -> {}", type.value(), executionId, recipients);
            }
        } else {
            log.debug("Workflow alert {} for execution {} already exists", type.value(), executionId);
        }
        return created;
    }

    @Transactional(readOnly = true)
    public List<WorkflowAlert> alertsFor(String executionId) {
        return repo.findByExecutionIdOrderByCreatedAtAsc(executionId);
    }
}
