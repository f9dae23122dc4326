package com.github.dimitryivaniuta.cmdb.workflow;

import java.util.List;

public record ExecutionHistory(List<WorkflowExecution> executions, long total, int limit, int offset) {
}
