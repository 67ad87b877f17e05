package com.phillippitts.docingest.service.transfer;

import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;
import com.phillippitts.docingest.testutil.FakeTransferClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class UploadTaskTest {

    private static final class RecordingCallbacks implements UploadTask.Callbacks {
        final List<Integer> progress = new CopyOnWriteArrayList<>();
        final AtomicReference<TransferReceipt> receipt = new AtomicReference<>();
        final AtomicReference<RuntimeException> failure = new AtomicReference<>();
        final AtomicInteger progressBeforeStart = new AtomicInteger(-1);

        @Override
        public void onTransferStarted(UploadItem item) {
            progressBeforeStart.set(progress.size());
        }

        @Override
        public void onUploadProgress(UploadItem item) {
            progress.add(item.snapshot().uploadProgress());
        }

        @Override
        public void onTransferred(UploadItem item, TransferReceipt r, long elapsedMs) {
            receipt.set(r);
        }

        @Override
        public void onTransferFailed(UploadItem item, RuntimeException f) {
            failure.set(f);
        }
    }

    private static UploadItem uploadingItem(String name) {
        UploadItem item = new UploadItem("e1", name, 4, null, "bank_statement_dkb");
        item.assignUploadId("u-1");
        item.transitionTo(ItemStatus.UPLOADING, null);
        return item;
    }

    @Test
    void reportsBoundariesAndHandsReceiptOver() {
        FakeTransferClient client = new FakeTransferClient();
        RecordingCallbacks callbacks = new RecordingCallbacks();
        UploadItem item = uploadingItem("a.csv");

        new UploadTask(item, new byte[]{1, 2, 3, 4}, client, new ProgressThrottle(0), callbacks).run();

        assertThat(callbacks.progressBeforeStart).hasValue(0);
        assertThat(callbacks.progress).startsWith(0).endsWith(100).isSorted();
        assertThat(callbacks.receipt.get().documentId()).isEqualTo("doc-a.csv");
        assertThat(client.requestFor("a.csv").uploadId()).isEqualTo("u-1");
        assertThat(client.requestFor("a.csv").targetCategory()).isEqualTo("bank_statement_dkb");
        assertThat(item.getStatus()).isEqualTo(ItemStatus.UPLOADING);
    }

    @Test
    void throttledIntermediateUpdatesStillIncludeBothBoundaries() {
        RecordingCallbacks callbacks = new RecordingCallbacks();

        new UploadTask(uploadingItem("a.csv"), new byte[]{1, 2, 3, 4}, new FakeTransferClient(),
                new ProgressThrottle(60_000), callbacks).run();

        assertThat(callbacks.progress).containsExactly(0, 100);
    }

    @Test
    void failureGoesToCallbacksWithoutEndingItem() {
        FakeTransferClient client = new FakeTransferClient().fail("a.csv", new TransferException("boom"));
        RecordingCallbacks callbacks = new RecordingCallbacks();
        UploadItem item = uploadingItem("a.csv");

        new UploadTask(item, new byte[]{1}, client, new ProgressThrottle(0), callbacks).run();

        assertThat(callbacks.failure.get()).isInstanceOf(TransferException.class);
        assertThat(callbacks.receipt.get()).isNull();
        assertThat(item.isTerminal()).isFalse();
    }

    @Test
    void authFailureIsPassedThroughUnchanged() {
        AuthFailureException auth = new AuthFailureException("transfer");
        FakeTransferClient client = new FakeTransferClient().fail("a.csv", auth);
        RecordingCallbacks callbacks = new RecordingCallbacks();

        new UploadTask(uploadingItem("a.csv"), new byte[]{1}, client, new ProgressThrottle(0), callbacks).run();

        assertThat(callbacks.failure.get()).isSameAs(auth);
    }

    @Test
    void doesNothingUnlessItemIsUploading() {
        FakeTransferClient client = new FakeTransferClient();
        RecordingCallbacks callbacks = new RecordingCallbacks();
        UploadItem item = new UploadItem("e1", "a.csv", 1, null, "bank_statement_dkb");
        item.skip("Skipped");

        new UploadTask(item, new byte[]{1}, client, new ProgressThrottle(0), callbacks).run();

        assertThat(client.requests()).isEmpty();
        assertThat(callbacks.progress).isEmpty();
        assertThat(callbacks.progressBeforeStart).hasValue(-1);
    }
}
