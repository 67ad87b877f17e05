package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.domain.BatchState;
import com.phillippitts.docingest.domain.BatchSubmission;
import com.phillippitts.docingest.domain.BatchSummary;
import com.phillippitts.docingest.domain.ItemSnapshot;
import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.domain.SubmittedFile;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.BatchAbortedException;
import com.phillippitts.docingest.exception.BatchNotFoundException;
import com.phillippitts.docingest.exception.InvalidFileException;
import com.phillippitts.docingest.service.dedup.DedupIndex;
import com.phillippitts.docingest.service.dedup.DedupKeyBuilder;
import com.phillippitts.docingest.service.detect.TypeDetector;
import com.phillippitts.docingest.service.metrics.IngestionMetrics;
import com.phillippitts.docingest.service.monitor.ProcessingMonitor;
import com.phillippitts.docingest.service.orchestration.event.BatchAbortedEvent;
import com.phillippitts.docingest.service.orchestration.event.BatchSettledEvent;
import com.phillippitts.docingest.service.orchestration.event.ItemStatusChangedEvent;
import com.phillippitts.docingest.service.orchestration.event.ResolutionRequestedEvent;
import com.phillippitts.docingest.service.registry.DocumentRegistry;
import com.phillippitts.docingest.service.registry.ExistingDocumentsSource;
import com.phillippitts.docingest.service.resolve.CategoryMismatchResolver;
import com.phillippitts.docingest.service.resolve.Decision;
import com.phillippitts.docingest.service.resolve.DuplicateCandidate;
import com.phillippitts.docingest.service.resolve.DuplicateResolver;
import com.phillippitts.docingest.service.resolve.MismatchCandidate;
import com.phillippitts.docingest.service.resolve.ResolutionRequest;
import com.phillippitts.docingest.service.transfer.ProgressThrottle;
import com.phillippitts.docingest.service.transfer.TransferClient;
import com.phillippitts.docingest.service.transfer.TransferReceipt;
import com.phillippitts.docingest.service.transfer.TransferTimeoutPolicy;
import com.phillippitts.docingest.service.transfer.UploadTask;
import com.phillippitts.docingest.service.validation.FileValidator;
import com.phillippitts.docingest.util.LogSanitizer;
import com.phillippitts.docingest.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of {@link BatchCoordinator}.
 *
 * <p><b>Pipeline per item:</b> validation, then type detection on the ingest executor. Items
 * whose dedup key collides go straight to {@code awaiting_duplicate_decision} while their
 * detection runs; every other item shows {@code detecting}. Once both the detection result and
 * the duplicate decision are in, a mismatching item waits for the consolidated mismatch request
 * and the rest start uploading. A completed transfer hands the item to the
 * {@link ProcessingMonitor}.
 *
 * <p><b>Thread Model:</b> no item waits on another item's transfer or poll. Transfers run on
 * their own executor; an item's transfer deadline is armed when its transfer thread starts, not
 * when the transfer is submitted. The only batch-level
 * barrier is the opening of the mismatch request, which happens once every item has passed
 * detection and duplicate gating, so that all mismatches are asked about together.
 *
 * <p><b>Shared state:</b> writes to the document registry and to the dedup indexes of live
 * batches all go through {@link #mutationLock}; completion callbacks never touch them directly.
 *
 * <p><b>Error Handling:</b> item-level failures end the item in {@code error}; siblings are not
 * affected. {@link AuthFailureException} from any call aborts the batch: all item scopes are
 * cancelled, non-terminal items are skipped and the settlement completes with
 * {@link BatchAbortedException}.
 */
public class DefaultBatchCoordinator implements BatchCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultBatchCoordinator.class);

    static final String ABORT_MESSAGE = "Cancelled: batch aborted (authentication required)";

    private final FileValidator validator;
    private final TypeDetector typeDetector;
    private final DuplicateResolver duplicateResolver;
    private final CategoryMismatchResolver mismatchResolver;
    private final TransferClient transferClient;
    private final TransferTimeoutPolicy timeoutPolicy;
    private final ProcessingMonitor monitor;
    private final ExistingDocumentsSource existingDocuments;
    private final DocumentRegistry registry;
    private final AsyncTaskExecutor executor;
    private final AsyncTaskExecutor transferExecutor;
    private final TaskScheduler scheduler;
    private final IngestionProperties properties;
    private final IngestionMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final Lock mutationLock = new ReentrantLock();
    private final Map<UUID, BatchJob> batches = new LinkedHashMap<>();
    private volatile boolean authRequired;

    DefaultBatchCoordinator(FileValidator validator,
                            TypeDetector typeDetector,
                            DuplicateResolver duplicateResolver,
                            CategoryMismatchResolver mismatchResolver,
                            TransferClient transferClient,
                            TransferTimeoutPolicy timeoutPolicy,
                            ProcessingMonitor monitor,
                            ExistingDocumentsSource existingDocuments,
                            DocumentRegistry registry,
                            AsyncTaskExecutor executor,
                            AsyncTaskExecutor transferExecutor,
                            TaskScheduler scheduler,
                            IngestionProperties properties,
                            IngestionMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this.validator = validator;
        this.typeDetector = typeDetector;
        this.duplicateResolver = duplicateResolver;
        this.mismatchResolver = mismatchResolver;
        this.transferClient = transferClient;
        this.timeoutPolicy = timeoutPolicy;
        this.monitor = monitor;
        this.existingDocuments = existingDocuments;
        this.registry = registry;
        this.executor = executor;
        this.transferExecutor = transferExecutor;
        this.scheduler = scheduler;
        this.properties = properties;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Override
    public BatchJob submit(BatchSubmission submission, BatchListener listener) {
        String targetCategory = submission.targetCategory();
        List<KnownDocument> known = refreshSnapshot();
        authRequired = false;

        List<UploadItem> items = new ArrayList<>(submission.files().size());
        Map<String, byte[]> contents = new LinkedHashMap<>();
        for (SubmittedFile file : submission.files()) {
            String entryKey = UUID.randomUUID().toString();
            Long size = file.content() != null ? Long.valueOf(file.content().length)
                    : file.size() >= 0 ? Long.valueOf(file.size()) : null;
            UploadItem item = new UploadItem(entryKey, file.name(), size == null ? -1 : size,
                    DedupKeyBuilder.keyFor(file.name(), size), targetCategory);
            items.add(item);
            contents.put(entryKey, file.content());
        }

        BatchJob job = new BatchJob(targetCategory, items, DedupIndex.fromSnapshot(known), known);
        job.addListener(listener);
        register(job);

        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("batchId", job.getId().toString())) {
            LOG.info("Batch {} submitted: {} files under {}", job.getId(), items.size(), targetCategory);
            start(job, submission, contents);
        }
        return job;
    }

    private List<KnownDocument> refreshSnapshot() {
        if (!properties.getBatch().isRefreshSnapshotOnSubmit()) {
            return registry.snapshot();
        }
        List<KnownDocument> fresh;
        try {
            fresh = existingDocuments.listDocuments();
        } catch (AuthFailureException e) {
            authRequired = true;
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Could not refresh existing documents, using the last known list: {}", e.getMessage());
            return registry.snapshot();
        }
        mutationLock.lock();
        try {
            registry.replaceAll(fresh);
        } finally {
            mutationLock.unlock();
        }
        return List.copyOf(fresh);
    }

    private void start(BatchJob job, BatchSubmission submission, Map<String, byte[]> contents) {
        List<UploadItem> valid = new ArrayList<>();
        for (int i = 0; i < job.items().size(); i++) {
            UploadItem item = job.items().get(i);
            try {
                validator.validate(submission.files().get(i), submission.targetCategory());
                job.holdContent(item.getEntryKey(), contents.get(item.getEntryKey()));
                valid.add(item);
            } catch (InvalidFileException e) {
                LOG.info("Rejected {}: {}", LogSanitizer.fileName(item.getFileName()), e.getReason());
                item.fail(e.getReason(), e.getMessage());
                itemFinished(job, item);
            }
        }
        job.expectGates(valid.size());

        List<DuplicateCandidate> conflicts = duplicateResolver.findConflicts(valid, job.dedupIndex(),
                job.knownDocuments());
        Set<String> conflicted = new HashSet<>();
        for (DuplicateCandidate candidate : conflicts) {
            conflicted.add(candidate.entryKey());
        }
        Optional<ResolutionRequest> duplicateRequest = duplicateResolver.open(job.getId(), conflicts);

        for (UploadItem item : valid) {
            if (conflicted.contains(item.getEntryKey())) {
                item.transitionTo(ItemStatus.AWAITING_DUPLICATE_DECISION, "Possible duplicate, waiting for a decision");
            } else {
                item.transitionTo(ItemStatus.DETECTING, "Detecting document type…");
            }
            emit(job, item);
        }
        duplicateRequest.ifPresent(request -> openRequest(job, request));

        for (UploadItem item : valid) {
            CompletableFuture<Decision> duplicateGate = duplicateRequest
                    .filter(r -> conflicted.contains(item.getEntryKey()))
                    .map(r -> r.decisionFor(item.getEntryKey()))
                    .orElseGet(() -> CompletableFuture.completedFuture(Decision.PROCEED));
            runGated(job, item, duplicateGate);
        }
        settleIfComplete(job);
    }

    private void runGated(BatchJob job, UploadItem item, CompletableFuture<Decision> duplicateGate) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("entryKey", item.getEntryKey())) {
            // a skip decision ends the item without waiting for its detection
            duplicateGate.thenAcceptAsync(decision -> {
                if (decision.proceeds() || job.isFinished()) {
                    return;
                }
                try (CloseableThreadContext.Instance inner = CloseableThreadContext
                        .put("batchId", job.getId().toString())
                        .put("entryKey", item.getEntryKey())) {
                    if (duplicateResolver.skip(item)) {
                        itemFinished(job, item);
                    }
                }
            }, executor);

            CompletableFuture<String> detection = typeDetector.detectAsync(item.getFileName(),
                    job.content(item.getEntryKey()));
            detection.thenCombine(duplicateGate, GateResult::new)
                    .whenCompleteAsync((result, failure) -> {
                        try (CloseableThreadContext.Instance inner = CloseableThreadContext
                                .put("batchId", job.getId().toString())
                                .put("entryKey", item.getEntryKey())) {
                            passGates(job, item, result, unwrap(failure));
                        }
                    }, executor);
        }
    }

    private record GateResult(String detectedCategory, Decision duplicateDecision) {
    }

    private void passGates(BatchJob job, UploadItem item, GateResult result, Throwable failure) {
        try {
            if (failure instanceof AuthFailureException auth) {
                abort(job, auth);
                return;
            }
            if (failure != null) {
                // request cancelled by an abort, or an unexpected pipeline failure
                if (!job.isFinished() && item.fail("Internal error", failure.toString())) {
                    LOG.error("Pipeline failure for {}", item.getEntryKey(), failure);
                    itemFinished(job, item);
                }
                return;
            }
            if (job.isFinished() || item.isTerminal()) {
                return;
            }
            if (!result.duplicateDecision().proceeds()) {
                if (duplicateResolver.skip(item)) {
                    itemFinished(job, item);
                }
                return;
            }
            item.setDetectedCategory(result.detectedCategory());
            if (mismatchResolver.isMismatch(item)) {
                MismatchCandidate candidate = mismatchResolver.candidateFor(item);
                job.addMismatchCandidate(candidate);
                item.transitionTo(ItemStatus.AWAITING_MISMATCH_DECISION, "Detected as "
                        + candidate.detectedCategory() + ", waiting for a decision");
                emit(job, item);
            } else {
                startUpload(job, item);
            }
        } finally {
            if (job.arriveAtGate()) {
                openMismatchRequest(job);
            }
        }
    }

    private void openMismatchRequest(BatchJob job) {
        List<MismatchCandidate> candidates = job.drainMismatchCandidates();
        if (job.isFinished()) {
            return;
        }
        mismatchResolver.open(job.getId(), candidates).ifPresent(request -> {
            openRequest(job, request);
            for (MismatchCandidate candidate : candidates) {
                UploadItem item = job.uploadItem(candidate.entryKey());
                request.decisionFor(candidate.entryKey()).whenCompleteAsync((decision, failure) -> {
                    if (failure != null || job.isFinished()) {
                        return;
                    }
                    try (CloseableThreadContext.Instance ctx = CloseableThreadContext
                            .put("batchId", job.getId().toString())
                            .put("entryKey", item.getEntryKey())) {
                        if (mismatchResolver.apply(item, decision)) {
                            LOG.debug("{} retargeted to {}", item.getEntryKey(), item.getTargetCategory());
                            startUpload(job, item);
                        } else {
                            itemFinished(job, item);
                        }
                    }
                }, executor);
            }
        });
    }

    private void openRequest(BatchJob job, ResolutionRequest request) {
        job.registerRequest(request);
        request.resolution().thenAccept(decisions -> {
            decisions.forEach((entry, decision) -> metrics.recordDecision(request.getKind(), decision));
            LOG.info("{} request of batch {} resolved: {}", request.getKind().wireName(), job.getId(), decisions.values());
        });
        LOG.info("Batch {} waiting on a {} decision for {} files", job.getId(), request.getKind().wireName(),
                request.getEntries().size());
        job.forEachListener(l -> l.onResolutionRequested(request));
        publisher.publishEvent(new ResolutionRequestedEvent(job.getId(), request.getKind(), request.getEntries(),
                Instant.now()));
    }

    private void startUpload(BatchJob job, UploadItem item) {
        if (job.isFinished()) {
            return;
        }
        item.assignUploadId(UUID.randomUUID().toString());
        if (!item.transitionTo(ItemStatus.UPLOADING, "Uploading…")) {
            return;
        }
        emit(job, item);

        byte[] content = job.content(item.getEntryKey());
        ItemCallbacks callbacks = new ItemCallbacks(job);
        UploadTask task = new UploadTask(item, content, transferClient,
                new ProgressThrottle(properties.getProgress().getThrottleMs()), callbacks);

        Future<?> transfer = transferExecutor.submit(task);
        job.scope(item.getEntryKey()).attachTransfer(transfer);
    }

    private void armDeadline(BatchJob job, UploadItem item) {
        Duration timeout = timeoutPolicy.timeoutFor(item.getFileSize());
        ScheduledFuture<?> deadline = scheduler.schedule(() -> onTransferTimeout(job, item, timeout),
                Instant.now().plus(timeout));
        job.scope(item.getEntryKey()).armDeadline(deadline);
    }

    private void onTransferTimeout(BatchJob job, UploadItem item, Duration timeout) {
        if (item.getStatus() != ItemStatus.UPLOADING) {
            return;
        }
        if (item.fail("Upload timed out after " + TimeUtils.humanize(timeout), "Transfer deadline exceeded")) {
            LOG.warn("Transfer of {} exceeded its {} deadline", LogSanitizer.fileName(item.getFileName()),
                    TimeUtils.humanize(timeout));
            job.scope(item.getEntryKey()).cancel();
            itemFinished(job, item);
        }
    }

    /**
     * Adapter receiving transfer and poll outcomes for one batch.
     */
    private final class ItemCallbacks implements UploadTask.Callbacks, ProcessingMonitor.Listener {

        private final BatchJob job;

        ItemCallbacks(BatchJob job) {
            this.job = job;
        }

        @Override
        public void onTransferStarted(UploadItem item) {
            armDeadline(job, item);
        }

        @Override
        public void onUploadProgress(UploadItem item) {
            emit(job, item);
        }

        @Override
        public void onTransferred(UploadItem item, TransferReceipt receipt, long elapsedMs) {
            ItemScope scope = job.scope(item.getEntryKey());
            scope.transferEnded();
            metrics.recordTransferLatency(elapsedMs);
            if (job.isFinished() || item.isTerminal()) {
                return;
            }
            item.recordReceipt(item.getUploadId(), receipt.documentId(), receipt.importSummary());
            job.releaseContent(item.getEntryKey());
            if (!item.transitionTo(ItemStatus.PROCESSING, "Processing…")) {
                return;
            }
            emit(job, item);
            scope.attachPoll(monitor.start(item, this));
        }

        @Override
        public void onTransferFailed(UploadItem item, RuntimeException failure) {
            job.scope(item.getEntryKey()).transferEnded();
            if (failure instanceof AuthFailureException auth) {
                abort(job, auth);
                return;
            }
            if (item.fail("Upload failed", failure.getMessage())) {
                itemFinished(job, item);
            }
        }

        @Override
        public void onProcessingProgress(UploadItem item) {
            emit(job, item);
        }

        @Override
        public void onProcessingFinished(UploadItem item, ProcessingMonitor.Outcome outcome, long elapsedMs) {
            metrics.recordProcessingLatency(elapsedMs);
            if (outcome == ProcessingMonitor.Outcome.EXHAUSTED) {
                metrics.recordPollExhausted(properties.getPoll().getExhaustionPolicy());
            }
            itemFinished(job, item);
        }

        @Override
        public void onAuthFailure(UploadItem item, AuthFailureException failure) {
            abort(job, failure);
        }
    }

    private void itemFinished(BatchJob job, UploadItem item) {
        ItemSnapshot snapshot = item.snapshot();
        if (snapshot.status() == ItemStatus.SUCCESS) {
            accept(job, snapshot);
        }
        job.releaseContent(item.getEntryKey());
        metrics.recordOutcome(snapshot.status());
        emit(job, item);
        settleIfComplete(job);
    }

    /**
     * Serialized mutation path for a succeeded item: document registry and dedup indexes.
     */
    private void accept(BatchJob job, ItemSnapshot snapshot) {
        mutationLock.lock();
        try {
            registry.add(new KnownDocument(snapshot.documentId(), snapshot.fileName(),
                    snapshot.fileSize() >= 0 ? snapshot.fileSize() : null, snapshot.targetCategory()));
            for (BatchJob live : batches.values()) {
                if (!live.isFinished() || live == job) {
                    live.dedupIndex().add(snapshot.dedupKey());
                }
            }
        } finally {
            mutationLock.unlock();
        }
    }

    private void settleIfComplete(BatchJob job) {
        job.settleIfComplete().ifPresent(summary -> {
            LOG.info("Batch {} settled: {} succeeded, {} failed, {} skipped", job.getId(),
                    summary.completedCount(), summary.failedCount(), summary.skippedCount());
            job.forEachListener(l -> l.onSettled(summary));
            publisher.publishEvent(new BatchSettledEvent(summary, Instant.now()));
            evictFinished();
        });
    }

    private void abort(BatchJob job, AuthFailureException cause) {
        authRequired = true;
        Optional<List<UploadItem>> skipped = job.abort("Authentication required", ABORT_MESSAGE);
        if (skipped.isEmpty()) {
            return;
        }
        LOG.warn("Batch {} aborted: credential rejected during {}", job.getId(), cause.getOperation());
        for (ItemScope scope : job.scopes()) {
            scope.cancel();
        }
        int cancelled = skipped.get().size();
        for (UploadItem item : skipped.get()) {
            metrics.recordOutcome(ItemStatus.SKIPPED);
            job.releaseContent(item.getEntryKey());
            emit(job, item);
        }
        metrics.incrementBatchAborted();
        BatchAbortedException failure = new BatchAbortedException(job.getId(), cause);
        BatchSummary summary = job.summary();
        job.failSettlement(failure);
        job.forEachListener(l -> l.onAborted(summary, failure));
        publisher.publishEvent(new BatchAbortedEvent(job.getId(), "Authentication required", cancelled, Instant.now()));
        evictFinished();
    }

    private void emit(BatchJob job, UploadItem item) {
        ItemSnapshot snapshot = item.snapshot();
        job.forEachListener(l -> l.onItemUpdated(job.getId(), snapshot));
        if (job.statusChanged(snapshot)) {
            publisher.publishEvent(new ItemStatusChangedEvent(job.getId(), snapshot, Instant.now()));
        }
    }

    private void register(BatchJob job) {
        mutationLock.lock();
        try {
            batches.put(job.getId(), job);
        } finally {
            mutationLock.unlock();
        }
    }

    private void evictFinished() {
        mutationLock.lock();
        try {
            int finished = 0;
            for (BatchJob job : batches.values()) {
                if (job.isFinished()) {
                    finished++;
                }
            }
            int excess = finished - properties.getBatch().getRetainedBatches();
            Iterator<BatchJob> it = batches.values().iterator();
            while (excess > 0 && it.hasNext()) {
                BatchJob job = it.next();
                if (job.isFinished()) {
                    it.remove();
                    excess--;
                    LOG.debug("Evicted batch {}", job.getId());
                }
            }
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public Optional<BatchJob> find(UUID batchId) {
        mutationLock.lock();
        try {
            return Optional.ofNullable(batches.get(batchId));
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public void release(UUID batchId) {
        mutationLock.lock();
        try {
            BatchJob job = batches.get(batchId);
            if (job == null) {
                throw new BatchNotFoundException(batchId);
            }
            if (job.getState() == BatchState.RUNNING) {
                throw new IllegalStateException("Batch " + batchId + " is still running");
            }
            batches.remove(batchId);
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public List<KnownDocument> documents() {
        return registry.snapshot();
    }

    @Override
    public Optional<KnownDocument> forgetDocument(String documentId) {
        mutationLock.lock();
        try {
            Optional<KnownDocument> removed = registry.removeById(documentId);
            removed.ifPresent(this::forgetKey);
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public List<KnownDocument> forgetCategory(String category) {
        mutationLock.lock();
        try {
            List<KnownDocument> removed = registry.removeByCategory(category);
            removed.forEach(this::forgetKey);
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    private void forgetKey(KnownDocument document) {
        String key = DedupKeyBuilder.keyFor(document.name(), document.size());
        for (BatchJob job : batches.values()) {
            if (!job.isFinished()) {
                job.dedupIndex().remove(key);
            }
        }
    }

    @Override
    public int activeBatchCount() {
        mutationLock.lock();
        try {
            int active = 0;
            for (BatchJob job : batches.values()) {
                if (!job.isFinished()) {
                    active++;
                }
            }
            return active;
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public boolean isAuthRequired() {
        return authRequired;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
