package com.phillippitts.docingest.exception;

import java.util.UUID;

/**
 * Thrown when a batch handle does not refer to a live or retained batch.
 */
public class BatchNotFoundException extends DocIngestException {

    private final UUID batchId;

    public BatchNotFoundException(UUID batchId) {
        super("Batch not found: " + batchId);
        this.batchId = batchId;
    }

    public UUID getBatchId() {
        return batchId;
    }
}
