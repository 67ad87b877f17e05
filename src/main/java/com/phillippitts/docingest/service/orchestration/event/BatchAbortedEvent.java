package com.phillippitts.docingest.service.orchestration.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a batch is abandoned as a whole.
 *
 * @param batchId aborted batch
 * @param reason privacy-safe reason (never a raw server payload)
 * @param cancelledItems items that were still in flight and got cancelled
 * @param timestamp when the abort happened
 */
public record BatchAbortedEvent(UUID batchId, String reason, int cancelledItems, Instant timestamp) {
}
