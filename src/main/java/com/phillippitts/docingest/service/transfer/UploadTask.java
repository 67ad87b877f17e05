package com.phillippitts.docingest.service.transfer;

import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.util.LogSanitizer;
import com.phillippitts.docingest.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Transfers one item's bytes under its target category.
 *
 * <p>The item must already be in {@code uploading}. Progress is throttled through a
 * {@link ProgressThrottle}; the 0% and 100% boundaries always reach the {@link Callbacks}. The
 * task never moves the item into a terminal state itself: outcomes are handed to the callbacks,
 * which belong to the batch coordinator.
 *
 * <p>Interrupting the running thread (cancelling the surrounding future) aborts the transfer;
 * the resulting failure is still reported, and the coordinator ignores it for items it has
 * already ended.
 */
public final class UploadTask implements Runnable {

    private static final Logger LOG = LogManager.getLogger(UploadTask.class);

    /**
     * Receives the outcome of a transfer.
     */
    public interface Callbacks {
        /** Runs on the transfer thread once it picked the task up, before any byte is sent. */
        void onTransferStarted(UploadItem item);

        void onUploadProgress(UploadItem item);

        void onTransferred(UploadItem item, TransferReceipt receipt, long elapsedMs);

        void onTransferFailed(UploadItem item, RuntimeException failure);
    }

    private final UploadItem item;
    private final byte[] content;
    private final TransferClient client;
    private final ProgressThrottle throttle;
    private final Callbacks callbacks;
    private int lastReported = -1;

    public UploadTask(UploadItem item, byte[] content, TransferClient client, ProgressThrottle throttle,
                      Callbacks callbacks) {
        this.item = Objects.requireNonNull(item, "item");
        this.content = content == null ? new byte[0] : content;
        this.client = Objects.requireNonNull(client, "client");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    }

    @Override
    public void run() {
        if (item.getStatus() != ItemStatus.UPLOADING) {
            LOG.debug("Transfer of {} not started: item is {}", item.getEntryKey(), item.getStatus().wireName());
            return;
        }
        callbacks.onTransferStarted(item);
        long t0 = System.nanoTime();
        report(0);
        TransferRequest request = new TransferRequest(item.getUploadId(), item.getFileName(), content,
                item.getTargetCategory());
        TransferReceipt receipt;
        try {
            receipt = client.transfer(request, (sent, total) -> report(ProgressThrottle.percentOf(sent, total)));
        } catch (AuthFailureException e) {
            callbacks.onTransferFailed(item, e);
            return;
        } catch (RuntimeException e) {
            LOG.warn("Transfer of {} failed after {} ms: {}", LogSanitizer.fileName(item.getFileName()),
                    TimeUtils.elapsedMillis(t0), e.getMessage());
            callbacks.onTransferFailed(item, e);
            return;
        }
        report(100);
        long elapsed = TimeUtils.elapsedMillis(t0);
        LOG.debug("Transferred {} ({} bytes) in {} ms", LogSanitizer.fileName(item.getFileName()),
                content.length, elapsed);
        callbacks.onTransferred(item, receipt, elapsed);
    }

    // the body may be written on a client thread
    private synchronized void report(int percent) {
        if (percent == lastReported || !throttle.shouldEmit(percent)) {
            return;
        }
        boolean changed = item.advanceUploadProgress(percent, "Uploading… " + percent + "%");
        boolean boundary = percent == 0 || percent == 100;
        if (changed || boundary) {
            lastReported = percent;
            callbacks.onUploadProgress(item);
        }
    }
}
