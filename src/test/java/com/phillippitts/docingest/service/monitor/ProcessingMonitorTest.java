package com.phillippitts.docingest.service.monitor;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;
import com.phillippitts.docingest.testutil.FakeStatusClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ProcessingMonitorTest {

    private ThreadPoolTaskScheduler scheduler;
    private IngestionProperties properties;
    private FakeStatusClient statusClient;
    private ProcessingMonitor monitor;
    private RecordingListener listener;

    private static final class RecordingListener implements ProcessingMonitor.Listener {
        final List<Integer> progress = new CopyOnWriteArrayList<>();
        final List<ProcessingMonitor.Outcome> outcomes = new CopyOnWriteArrayList<>();
        final AtomicReference<AuthFailureException> authFailure = new AtomicReference<>();

        @Override
        public void onProcessingProgress(UploadItem item) {
            progress.add(item.snapshot().processingProgress());
        }

        @Override
        public void onProcessingFinished(UploadItem item, ProcessingMonitor.Outcome outcome, long elapsedMs) {
            outcomes.add(outcome);
        }

        @Override
        public void onAuthFailure(UploadItem item, AuthFailureException failure) {
            authFailure.set(failure);
        }
    }

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        properties = new IngestionProperties();
        properties.getPoll().setIntervalMs(10);
        properties.getPoll().setMaxAttempts(50);
        statusClient = new FakeStatusClient();
        monitor = new ProcessingMonitor(statusClient, scheduler, properties);
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static UploadItem processingItem(String uploadId) {
        UploadItem item = new UploadItem("e-" + uploadId, uploadId + ".csv", 10, null, "bank_statement_dkb");
        item.assignUploadId(uploadId);
        item.transitionTo(ItemStatus.UPLOADING, null);
        item.transitionTo(ItemStatus.PROCESSING, null);
        return item;
    }

    @Test
    void progressNeverRegressesAndCompletionForcesHundred() {
        statusClient.script("u1", ProcessingStatus.progress(42), ProcessingStatus.progress(30),
                new ProcessingStatus(ProcessingStatus.State.COMPLETE, 100, 120, 120, null));
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(item::isTerminal);
        assertThat(listener.progress).containsExactly(42);
        assertThat(item.snapshot().status()).isEqualTo(ItemStatus.SUCCESS);
        assertThat(item.snapshot().processingProgress()).isEqualTo(100);
        assertThat(item.snapshot().message()).isEqualTo("Imported 120 records");
        assertThat(listener.outcomes).containsExactly(ProcessingMonitor.Outcome.COMPLETED);
        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.activeLoopCount() == 0);
    }

    @Test
    void serverErrorFailsItemWithServerMessage() {
        statusClient.script("u1", ProcessingStatus.error("Unsupported statement layout"));
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(item::isTerminal);
        assertThat(item.snapshot().status()).isEqualTo(ItemStatus.ERROR);
        assertThat(item.snapshot().message()).isEqualTo("Unsupported statement layout");
        assertThat(listener.outcomes).containsExactly(ProcessingMonitor.Outcome.FAILED);
    }

    @Test
    void transportFailuresAreRetried() {
        statusClient.script("u1", new TransferException("Backend unreachable"),
                new TransferException("Backend unreachable"), ProcessingStatus.complete());
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(item::isTerminal);
        assertThat(item.getStatus()).isEqualTo(ItemStatus.SUCCESS);
        assertThat(statusClient.callCount()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void exhaustionWithForcedSuccessPolicy() {
        properties.getPoll().setMaxAttempts(3);
        properties.getPoll().setExhaustionPolicy(PollExhaustionPolicy.FORCED_SUCCESS);
        statusClient.fallback(id -> ProcessingStatus.progress(10));
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(item::isTerminal);
        assertThat(item.snapshot().status()).isEqualTo(ItemStatus.SUCCESS);
        assertThat(item.snapshot().message()).isEqualTo("Processing status unconfirmed after 3 attempts");
        assertThat(listener.outcomes).containsExactly(ProcessingMonitor.Outcome.EXHAUSTED);
        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.activeLoopCount() == 0);
        int callsAtEnd = statusClient.callCount();
        await().pollDelay(Duration.ofMillis(100)).until(() -> true);
        assertThat(statusClient.callCount()).isEqualTo(callsAtEnd);
    }

    @Test
    void exhaustionWithTimeoutErrorPolicy() {
        properties.getPoll().setMaxAttempts(2);
        properties.getPoll().setExhaustionPolicy(PollExhaustionPolicy.TIMEOUT_ERROR);
        statusClient.fallback(id -> new ProcessingStatus(ProcessingStatus.State.QUEUED, 0, null, null, null));
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(item::isTerminal);
        assertThat(item.snapshot().status()).isEqualTo(ItemStatus.ERROR);
        assertThat(item.snapshot().message()).isEqualTo("Processing timed out after 2 attempts");
    }

    @Test
    void authFailureStopsLoopAndIsReported() {
        statusClient.script("u1", new AuthFailureException("status"));
        UploadItem item = processingItem("u1");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.authFailure.get() != null);
        assertThat(item.isTerminal()).isFalse();
        assertThat(listener.outcomes).isEmpty();
        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.activeLoopCount() == 0);
    }

    @Test
    void cancelStopsPolling() {
        statusClient.fallback(id -> ProcessingStatus.progress(5));
        UploadItem item = processingItem("u1");

        ProcessingMonitor.PollHandle handle = monitor.start(item, listener);
        await().atMost(Duration.ofSeconds(5)).until(() -> statusClient.callCount() > 0);
        handle.cancel();

        assertThat(handle.isActive()).isFalse();
        assertThat(monitor.activeLoopCount()).isZero();
        assertThat(item.isTerminal()).isFalse();
    }

    @Test
    void loopForAlreadyEndedItemStopsWithoutPolling() {
        UploadItem item = processingItem("u1");
        item.skip("Cancelled");

        monitor.start(item, listener);

        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.activeLoopCount() == 0);
        assertThat(statusClient.callCount()).isZero();
        assertThat(listener.outcomes).isEmpty();
    }

    @Test
    void describesRecordProgress() {
        assertThat(new ProcessingStatus(ProcessingStatus.State.PROCESSING, 25, 30, 120, null).describe())
                .isEqualTo("Processing… 30/120 records");
        assertThat(ProcessingStatus.progress(140).describe()).isEqualTo("Processing… 100%");
        assertThat(ProcessingStatus.State.fromWire("completed")).isEqualTo(ProcessingStatus.State.COMPLETE);
        assertThat(ProcessingStatus.State.fromWire("weird")).isEqualTo(ProcessingStatus.State.UNKNOWN);
    }
}
