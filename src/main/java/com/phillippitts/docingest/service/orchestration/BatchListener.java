package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.domain.BatchSummary;
import com.phillippitts.docingest.domain.ItemSnapshot;
import com.phillippitts.docingest.exception.BatchAbortedException;
import com.phillippitts.docingest.service.resolve.ResolutionRequest;

import java.util.UUID;

/**
 * Consumer-side observer of one batch. Callbacks arrive on pipeline threads, in no particular
 * order across items; implementations must be thread-safe and should return quickly.
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() { };

    /**
     * An item changed status, progress or message.
     */
    default void onItemUpdated(UUID batchId, ItemSnapshot item) {
    }

    /**
     * A consolidated decision is needed. Decide through the request or through
     * {@link BatchJob#decide}.
     */
    default void onResolutionRequested(ResolutionRequest request) {
    }

    default void onSettled(BatchSummary summary) {
    }

    default void onAborted(BatchSummary summary, BatchAbortedException failure) {
    }
}
