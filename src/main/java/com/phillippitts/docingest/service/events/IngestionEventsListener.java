package com.phillippitts.docingest.service.events;

import com.phillippitts.docingest.domain.ItemSnapshot;
import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.service.orchestration.event.BatchAbortedEvent;
import com.phillippitts.docingest.service.orchestration.event.BatchSettledEvent;
import com.phillippitts.docingest.service.orchestration.event.ItemStatusChangedEvent;
import com.phillippitts.docingest.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Writes one warning per kind of ingestion failure and quiet window, so a batch whose files all
 * fail the same way does not flood the log.
 */
@Component
class IngestionEventsListener {
    private static final Logger LOG = LogManager.getLogger(IngestionEventsListener.class);

    private final Clock clock;
    private final Duration quietWindow;
    private final ConcurrentMap<String, Instant> windowStart = new ConcurrentHashMap<>();

    IngestionEventsListener() {
        this(Clock.systemUTC(), Duration.ofMinutes(1));
    }

    IngestionEventsListener(Clock clock, Duration quietWindow) {
        this.clock = clock;
        this.quietWindow = quietWindow;
    }

    @EventListener
    void onItemStatusChanged(ItemStatusChangedEvent e) {
        ItemSnapshot item = e.item();
        if (item.status() != ItemStatus.ERROR) {
            return;
        }
        if (firstInWindow("item:" + LogSanitizer.truncate(item.message(), 40))) {
            LOG.warn("Item failed: batch={}, file={}, message={}", e.batchId(),
                    LogSanitizer.fileName(item.fileName()), LogSanitizer.truncate(item.message(), 120));
        }
    }

    @EventListener
    void onBatchAborted(BatchAbortedEvent e) {
        if (firstInWindow("abort")) {
            LOG.warn("Batch {} aborted: {} ({} items cancelled). Re-authenticate and resubmit.",
                    e.batchId(), e.reason(), e.cancelledItems());
        }
    }

    @EventListener
    void onBatchSettled(BatchSettledEvent e) {
        if (e.summary().failedCount() > 0) {
            LOG.info("Batch {} settled with {} failed of {} items", e.summary().batchId(),
                    e.summary().failedCount(), e.summary().items().size());
        }
    }

    /** True when {@code kind} has not been logged within the current quiet window. */
    boolean firstInWindow(String kind) {
        Instant now = clock.instant();
        Instant[] opened = new Instant[1];
        windowStart.compute(kind, (k, start) -> {
            if (start == null || !now.isBefore(start.plus(quietWindow))) {
                opened[0] = now;
                return now;
            }
            return start;
        });
        return opened[0] != null;
    }
}
