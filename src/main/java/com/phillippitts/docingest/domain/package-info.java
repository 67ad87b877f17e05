/**
 * Domain model for batch document ingestion.
 *
 * <p>{@link com.phillippitts.docingest.domain.UploadItem} is the only mutable type; it guards its
 * own state machine. Everything handed to listeners and API clients is an immutable snapshot
 * ({@link com.phillippitts.docingest.domain.ItemSnapshot},
 * {@link com.phillippitts.docingest.domain.BatchSummary}).
 */
package com.phillippitts.docingest.domain;
