/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.docingest.exception.DocIngestException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.docingest.exception.InvalidFileException} - A submitted file
 *       fails validation; the item ends in {@code error}, the batch continues</li>
 *   <li>{@link com.phillippitts.docingest.exception.TransferException} - Backend call failed at
 *       the transport level; terminal for a transfer, retried for a status poll</li>
 *   <li>{@link com.phillippitts.docingest.exception.ProcessingFailedException} - The server
 *       reported that processing an upload failed</li>
 *   <li>{@link com.phillippitts.docingest.exception.AuthFailureException} - Credential rejected;
 *       the only failure that aborts a whole batch</li>
 *   <li>{@link com.phillippitts.docingest.exception.BatchAbortedException} - Batch-level failure
 *       surfaced through the batch settlement future</li>
 * </ul>
 *
 * <p>Item-level failures are recovered locally by the coordinator (item marked {@code error});
 * HTTP mapping happens in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.docingest.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.docingest.exception;
