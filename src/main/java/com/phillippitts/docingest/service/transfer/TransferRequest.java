package com.phillippitts.docingest.service.transfer;

/**
 * One file transfer.
 *
 * @param uploadId caller-supplied idempotent identifier; also the key for status polling
 * @param fileName original file name
 * @param content file bytes
 * @param targetCategory category key the document is imported under
 */
public record TransferRequest(String uploadId, String fileName, byte[] content, String targetCategory) {
}
