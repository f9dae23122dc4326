package com.github.dimitryivaniuta.cmdb.report;

import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.resource.DataChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Drops cached results of every catalog query that reads the changed data, once the change has
 * committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportCacheInvalidator {

    private final ReportQueryCatalog catalog;
    private final ReportCache cache;

    @TransactionalEventListener(fallbackExecution = true)
    public void onDataChanged(DataChangedEvent event) {
        int removed = 0;
        for (NamedReportQuery q : catalog.dependingOn(event.source())) {
            removed += cache.invalidate(ReportCache.KEY_PREFIX + q.name() + ":*");
        }
        if (removed > 0) {
            log.debug("Invalidated {} cached report results after {} {} {}",
                    removed, event.operation(), event.source(), event.entityId());
        }
    }
}
