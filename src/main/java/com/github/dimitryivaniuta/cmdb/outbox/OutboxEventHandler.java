package com.github.dimitryivaniuta.cmdb.outbox;

/**
 * Applies one type of outbox event. Runs inside the dispatch transaction; throwing rolls the
 * handler's writes back and schedules a retry.
 */
public interface OutboxEventHandler {

    String eventType();

    void handle(OutboxEvent event);
}
