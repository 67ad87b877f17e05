package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.domain.BatchSubmission;
import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.BatchNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs submitted batches and owns the state shared between them: the document list and the
 * dedup indexes of live batches.
 *
 * <p>All items of a batch progress concurrently. Item-level failures stay with the item; an
 * authentication failure aborts the whole batch.
 */
public interface BatchCoordinator {

    /**
     * Starts a batch. Returns as soon as the items are created and validated; detection,
     * resolution, transfer and processing continue in the background.
     *
     * @param listener observer registered before any item is updated
     * @return handle of the new batch
     * @throws AuthFailureException if the existing-documents snapshot is refused
     */
    BatchJob submit(BatchSubmission submission, BatchListener listener);

    default BatchJob submit(BatchSubmission submission) {
        return submit(submission, BatchListener.NONE);
    }

    Optional<BatchJob> find(UUID batchId);

    /**
     * @throws BatchNotFoundException if the batch is unknown or was evicted
     */
    default BatchJob get(UUID batchId) {
        return find(batchId).orElseThrow(() -> new BatchNotFoundException(batchId));
    }

    /**
     * Forgets a finished batch.
     *
     * @throws BatchNotFoundException if the batch is unknown
     * @throws IllegalStateException if the batch is still running
     */
    void release(UUID batchId);

    /**
     * @return the externally-visible document list, newest first
     */
    List<KnownDocument> documents();

    /**
     * Removes a deleted document from the document list and from every live dedup index.
     *
     * @return the removed entry, empty if it was not listed
     */
    Optional<KnownDocument> forgetDocument(String documentId);

    /**
     * Removes all documents of a category from the document list and from every live dedup index.
     *
     * @return the removed entries
     */
    List<KnownDocument> forgetCategory(String category);

    int activeBatchCount();

    /**
     * @return {@code true} after an authentication failure, until a later submission succeeds
     */
    boolean isAuthRequired();
}
