package com.phillippitts.docingest.service.transfer;

/**
 * Response of the transfer endpoint.
 *
 * @param documentId id the backend assigned to the stored document
 * @param importSummary optional human-readable summary of what was imported
 */
public record TransferReceipt(String documentId, String importSummary) {
}
