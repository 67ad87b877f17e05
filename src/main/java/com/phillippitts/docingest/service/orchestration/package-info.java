/**
 * Batch coordination: runs every item of a submitted batch through validation, detection,
 * duplicate and mismatch gating, transfer and processing, concurrently across items.
 *
 * <p>Entry point is {@link com.phillippitts.docingest.service.orchestration.BatchCoordinator};
 * consumers observe a batch through its
 * {@link com.phillippitts.docingest.service.orchestration.BatchJob} handle and a
 * {@link com.phillippitts.docingest.service.orchestration.BatchListener}.
 */
package com.phillippitts.docingest.service.orchestration;
