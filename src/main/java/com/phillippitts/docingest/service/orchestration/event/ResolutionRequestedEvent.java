package com.phillippitts.docingest.service.orchestration.event;

import com.phillippitts.docingest.service.resolve.ResolutionKind;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Emitted when a batch opens a consolidated decision request.
 *
 * @param batchId owning batch
 * @param kind duplicate or mismatch
 * @param entries entry keys covered by the request
 * @param timestamp when the request was opened
 */
public record ResolutionRequestedEvent(UUID batchId, ResolutionKind kind, List<String> entries, Instant timestamp) {
}
