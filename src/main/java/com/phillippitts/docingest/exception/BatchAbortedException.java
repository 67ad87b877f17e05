package com.phillippitts.docingest.exception;

import java.util.UUID;

/**
 * Batch-level failure surfaced to the caller when a batch had to be abandoned as a whole.
 * The cause is the failure that invalidated the batch (typically {@link AuthFailureException}).
 */
public class BatchAbortedException extends DocIngestException {

    private final UUID batchId;

    public BatchAbortedException(UUID batchId, Throwable cause) {
        super("Batch " + batchId + " aborted: " + cause.getMessage(), cause);
        this.batchId = batchId;
    }

    public UUID getBatchId() {
        return batchId;
    }
}
