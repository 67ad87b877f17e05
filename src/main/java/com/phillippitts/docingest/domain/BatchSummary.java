package com.phillippitts.docingest.domain;

import java.util.List;
import java.util.UUID;

/**
 * Aggregate view of a batch.
 *
 * @param batchId batch handle
 * @param state running, settled or aborted
 * @param overallProgress mean item contribution, 100 once every item is terminal
 * @param completedCount items in {@code success}
 * @param failedCount items in {@code error} (skips are not failures)
 * @param skippedCount items in {@code skipped}
 * @param inProgressCount items not yet terminal
 * @param failureMessage batch-level failure, null unless aborted
 * @param items per-item snapshots in submission order
 */
public record BatchSummary(
        UUID batchId,
        BatchState state,
        double overallProgress,
        int completedCount,
        int failedCount,
        int skippedCount,
        int inProgressCount,
        String failureMessage,
        List<ItemSnapshot> items
) {

    public BatchSummary {
        items = List.copyOf(items);
    }

    /**
     * Builds the aggregate from item snapshots.
     */
    public static BatchSummary of(UUID batchId, BatchState state, String failureMessage, List<ItemSnapshot> items) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        int inProgress = 0;
        double total = 0.0;
        for (ItemSnapshot item : items) {
            total += item.progressContribution();
            switch (item.status()) {
                case SUCCESS -> completed++;
                case ERROR -> failed++;
                case SKIPPED -> skipped++;
                default -> inProgress++;
            }
        }
        double overall = items.isEmpty() ? 100.0 : total / items.size();
        return new BatchSummary(batchId, state, overall, completed, failed, skipped, inProgress, failureMessage, items);
    }

    public boolean settled() {
        return inProgressCount == 0;
    }
}
