package com.phillippitts.docingest.domain;

/**
 * Immutable point-in-time view of an {@link UploadItem}, handed to listeners and API clients.
 *
 * @param entryKey stable identifier of the batch slot
 * @param fileName display name as submitted
 * @param fileSize size in bytes
 * @param dedupKey normalized {@code name::size}, null when the file bypasses dedup
 * @param targetCategory category the item is (or will be) submitted under
 * @param detectedCategory classifier output, null when unknown
 * @param uploadProgress transfer progress 0-100
 * @param processingProgress server-side processing progress 0-100
 * @param status lifecycle status
 * @param message latest human-readable message
 * @param errorDetail diagnostic detail for {@code error} items
 * @param documentId id assigned by the backend once transferred
 * @param importSummary optional summary returned by the transfer endpoint
 */
public record ItemSnapshot(
        String entryKey,
        String fileName,
        long fileSize,
        String dedupKey,
        String targetCategory,
        String detectedCategory,
        int uploadProgress,
        int processingProgress,
        ItemStatus status,
        String message,
        String errorDetail,
        String documentId,
        String importSummary
) {

    public boolean terminal() {
        return status.isTerminal();
    }

    /**
     * Contribution of this item to the batch's overall progress.
     */
    public double progressContribution() {
        if (terminal()) {
            return 100.0;
        }
        return uploadProgress * 0.5 + processingProgress * 0.5;
    }
}
