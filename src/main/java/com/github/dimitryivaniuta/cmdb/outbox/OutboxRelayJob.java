package com.github.dimitryivaniuta.cmdb.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelayJob {

    private final OutboxProcessor processor;
    private final OutboxEventRepository repo;
    private final OutboxProperties props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${cmdb.outbox.poll-interval-ms:5000}")
    public void relay() {
        int processed = processor.processDue();
        if (processed > 0) {
            log.debug("Outbox relay applied {} events", processed);
        }
    }

    @Transactional
    @Scheduled(cron = "0 15 3 * * *") // daily
    public void purgeProcessed() {
        int deleted = repo.deleteProcessedBefore(clock.instant().minus(props.getProcessedRetention()));
        if (deleted > 0) {
            log.info("Outbox cleanup deleted {} processed events", deleted);
        }
    }
}
