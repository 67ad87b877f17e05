/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by
 *       {@link com.phillippitts.docingest.config.logging.MdcFilter}</li>
 *   <li>{@code batchId} - batch being processed, set by the coordinator</li>
 *   <li>{@code entryKey} - item being processed, set by the coordinator</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [ingest-pool-3] [requestId] [batchId] [entryKey] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.docingest.config.logging;
