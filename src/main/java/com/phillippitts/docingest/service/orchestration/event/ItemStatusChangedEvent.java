package com.phillippitts.docingest.service.orchestration.event;

import com.phillippitts.docingest.domain.ItemSnapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when an item moves to a new lifecycle status. Progress-only updates are not published.
 *
 * @param batchId owning batch
 * @param item snapshot taken right after the transition
 * @param timestamp when the transition was observed
 */
public record ItemStatusChangedEvent(UUID batchId, ItemSnapshot item, Instant timestamp) {
}
