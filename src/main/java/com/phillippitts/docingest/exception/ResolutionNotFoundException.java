package com.phillippitts.docingest.exception;

import java.util.UUID;

/**
 * Thrown when decisions are submitted for a resolution kind that has no open request in the batch.
 */
public class ResolutionNotFoundException extends DocIngestException {

    public ResolutionNotFoundException(UUID batchId, String kind) {
        super("No open " + kind + " resolution request in batch " + batchId);
    }
}
