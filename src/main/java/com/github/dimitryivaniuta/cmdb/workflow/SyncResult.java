package com.github.dimitryivaniuta.cmdb.workflow;

public record SyncResult(int workflows, int executions, int orphansRemoved, PollingResult polling) {
}
