package com.phillippitts.docingest.service.orchestration.event;

import com.phillippitts.docingest.domain.BatchSummary;

import java.time.Instant;

/**
 * Emitted once every item of a batch reached a terminal status.
 */
public record BatchSettledEvent(BatchSummary summary, Instant timestamp) {
}
