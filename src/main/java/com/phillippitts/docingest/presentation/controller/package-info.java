/**
 * REST endpoints for batch ingestion.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/batches} - submit files (multipart {@code files}, {@code category}) → 202</li>
 *   <li>{@code GET /api/batches/{id}} - batch summary</li>
 *   <li>{@code GET /api/batches/{id}/resolutions} - open decision requests</li>
 *   <li>{@code POST /api/batches/{id}/resolutions/{kind}} - decide ({@code duplicate} or {@code mismatch})</li>
 *   <li>{@code GET /api/batches/{id}/events} - server-sent item and batch events</li>
 *   <li>{@code DELETE /api/batches/{id}} - forget a finished batch</li>
 *   <li>{@code GET /api/documents}, {@code DELETE /api/documents/{id}},
 *       {@code DELETE /api/documents/by-category/{category}}</li>
 * </ul>
 *
 * <p>Errors are mapped by {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.docingest.presentation.controller;
