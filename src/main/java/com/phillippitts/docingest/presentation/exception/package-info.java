/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.docingest.exception.InvalidFileException}, malformed requests → 400</li>
 *   <li>{@link com.phillippitts.docingest.exception.AuthFailureException} → 401</li>
 *   <li>{@link com.phillippitts.docingest.exception.BatchNotFoundException},
 *       {@link com.phillippitts.docingest.exception.ResolutionNotFoundException} → 404</li>
 *   <li>{@code IllegalStateException} (e.g. request already resolved, batch still running) → 409</li>
 *   <li>{@link com.phillippitts.docingest.exception.TransferException} → 502</li>
 *   <li>{@code Exception} (catch-all) → 500</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidFileException",
 *   "message": "Invalid file",
 *   "details": "Invalid file (notes.txt): Unsupported file type .txt; allowed: csv, pdf",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.docingest.presentation.exception;
