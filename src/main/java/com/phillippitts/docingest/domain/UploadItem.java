package com.phillippitts.docingest.domain;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One file's lifecycle unit inside a batch.
 *
 * <p>All mutators are thread-safe and guarded by a {@link ReentrantLock}: the detection task,
 * the transfer task, the poll loop and the coordinator may touch the same item from different
 * threads. Mutators return {@code false} instead of throwing when the state machine rejects an
 * update, because late callbacks (a poll response arriving after cancellation, say) are normal.
 *
 * <p>Invariants enforced here:
 * <ul>
 *   <li>status only moves forward, except into {@code error}/{@code skipped}; terminal is final</li>
 *   <li>{@code uploadProgress} and {@code processingProgress} are clamped to [0,100] and never regress</li>
 *   <li>{@code processingProgress} reaches 100 only together with the transition to {@code success}</li>
 *   <li>{@code targetCategory} is frozen once the item starts uploading</li>
 * </ul>
 */
public final class UploadItem {

    private final Lock lock = new ReentrantLock();

    private final String entryKey;
    private final String fileName;
    private final long fileSize;
    private final String dedupKey;

    private String targetCategory;
    private String detectedCategory;
    private int uploadProgress;
    private int processingProgress;
    private ItemStatus status = ItemStatus.QUEUED;
    private String message = "Waiting to start…";
    private String errorDetail;
    private String uploadId;
    private String documentId;
    private String importSummary;

    public UploadItem(String entryKey, String fileName, long fileSize, String dedupKey, String targetCategory) {
        this.entryKey = Objects.requireNonNull(entryKey, "entryKey");
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.dedupKey = dedupKey;
        this.targetCategory = Objects.requireNonNull(targetCategory, "targetCategory");
    }

    public String getEntryKey() {
        return entryKey;
    }

    public String getFileName() {
        return fileName;
    }

    public long getFileSize() {
        return fileSize;
    }

    /**
     * @return normalized {@code name::size} key, or {@code null} when the file bypasses dedup
     */
    public String getDedupKey() {
        return dedupKey;
    }

    public ItemStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }

    public String getTargetCategory() {
        lock.lock();
        try {
            return targetCategory;
        } finally {
            lock.unlock();
        }
    }

    public String getDetectedCategory() {
        lock.lock();
        try {
            return detectedCategory;
        } finally {
            lock.unlock();
        }
    }

    public String getUploadId() {
        lock.lock();
        try {
            return uploadId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the item to {@code next} if the state machine allows it.
     *
     * @return {@code true} if the transition happened
     */
    public boolean transitionTo(ItemStatus next, String newMessage) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            if (!status.canTransitionTo(next)) {
                return false;
            }
            if (next == ItemStatus.SUCCESS) {
                processingProgress = 100;
            }
            if (next == ItemStatus.PROCESSING) {
                uploadProgress = 100;
                processingProgress = 0;
            }
            status = next;
            if (newMessage != null) {
                message = newMessage;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal {@code error} exit.
     */
    public boolean fail(String newMessage, String detail) {
        lock.lock();
        try {
            if (!transitionTo(ItemStatus.ERROR, newMessage)) {
                return false;
            }
            errorDetail = detail;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal {@code skipped} exit.
     */
    public boolean skip(String newMessage) {
        return transitionTo(ItemStatus.SKIPPED, newMessage);
    }

    /**
     * Marks the item {@code success}; {@code processingProgress} is forced to 100 in the same step.
     */
    public boolean complete(String newMessage) {
        return transitionTo(ItemStatus.SUCCESS, newMessage);
    }

    /**
     * Records the classifier output. Allowed until the item starts uploading.
     */
    public void setDetectedCategory(String category) {
        lock.lock();
        try {
            if (status.ordinal() < ItemStatus.UPLOADING.ordinal()) {
                detectedCategory = category;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changes the category the item will be submitted under.
     *
     * @throws IllegalStateException once the item has started uploading
     */
    public void retarget(String category) {
        Objects.requireNonNull(category, "category");
        lock.lock();
        try {
            if (status.ordinal() >= ItemStatus.UPLOADING.ordinal()) {
                throw new IllegalStateException("Target category of " + entryKey
                        + " is frozen in status " + status.wireName());
            }
            targetCategory = category;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Raises transfer progress. Only applies while uploading; lower values are ignored.
     *
     * @return {@code true} if the stored value changed
     */
    public boolean advanceUploadProgress(int percent, String newMessage) {
        lock.lock();
        try {
            if (status != ItemStatus.UPLOADING) {
                return false;
            }
            int clamped = clamp(percent, 100);
            if (clamped <= uploadProgress) {
                return false;
            }
            uploadProgress = clamped;
            if (newMessage != null) {
                message = newMessage;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Raises processing progress. Only applies while processing; lower values are ignored and the
     * value is held below 100 until {@link #complete(String)}.
     *
     * @return {@code true} if the stored value changed
     */
    public boolean advanceProcessingProgress(int percent, String newMessage) {
        lock.lock();
        try {
            if (status != ItemStatus.PROCESSING) {
                return false;
            }
            int clamped = clamp(percent, 99);
            if (clamped <= processingProgress) {
                if (newMessage != null) {
                    message = newMessage;
                }
                return false;
            }
            processingProgress = clamped;
            if (newMessage != null) {
                message = newMessage;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the identifiers returned by the transfer endpoint.
     */
    public void recordReceipt(String newUploadId, String newDocumentId, String newImportSummary) {
        lock.lock();
        try {
            uploadId = newUploadId;
            documentId = newDocumentId;
            importSummary = newImportSummary;
        } finally {
            lock.unlock();
        }
    }

    public void assignUploadId(String newUploadId) {
        lock.lock();
        try {
            uploadId = newUploadId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return consistent point-in-time copy of all fields
     */
    public ItemSnapshot snapshot() {
        lock.lock();
        try {
            return new ItemSnapshot(entryKey, fileName, fileSize, dedupKey, targetCategory, detectedCategory,
                    uploadProgress, processingProgress, status, message, errorDetail, documentId, importSummary);
        } finally {
            lock.unlock();
        }
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    @Override
    public String toString() {
        return "UploadItem{" + entryKey + ", " + getStatus().wireName() + '}';
    }
}
