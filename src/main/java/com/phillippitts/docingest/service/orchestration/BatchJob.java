package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.domain.BatchState;
import com.phillippitts.docingest.domain.BatchSummary;
import com.phillippitts.docingest.domain.ItemSnapshot;
import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.BatchAbortedException;
import com.phillippitts.docingest.exception.ResolutionNotFoundException;
import com.phillippitts.docingest.service.dedup.DedupIndex;
import com.phillippitts.docingest.service.resolve.MismatchCandidate;
import com.phillippitts.docingest.service.resolve.ResolutionKind;
import com.phillippitts.docingest.service.resolve.ResolutionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Handle of one submitted batch: its items, their aggregate, open decision requests and the
 * settlement signal.
 *
 * <p>The public methods form the consumer surface. Package-private members belong to the
 * coordinator that runs the batch.
 */
public final class BatchJob {

    private static final Logger LOG = LogManager.getLogger(BatchJob.class);

    private final UUID id = UUID.randomUUID();
    private final Instant createdAt = Instant.now();
    private final String targetCategory;
    private final List<UploadItem> items;
    private final Map<String, UploadItem> itemsByKey = new LinkedHashMap<>();
    private final DedupIndex dedupIndex;
    private final List<KnownDocument> knownDocuments;

    private final Map<String, byte[]> contents = new ConcurrentHashMap<>();
    private final Map<String, ItemScope> scopes = new ConcurrentHashMap<>();
    private final Map<String, ItemStatus> lastPublishedStatus = new ConcurrentHashMap<>();
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private final List<MismatchCandidate> mismatchCandidates = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger pendingGates = new AtomicInteger();

    private final Lock lock = new ReentrantLock();
    private final Map<ResolutionKind, ResolutionRequest> openRequests = new EnumMap<>(ResolutionKind.class);
    private final CompletableFuture<BatchSummary> settlement = new CompletableFuture<>();
    private BatchState state = BatchState.RUNNING;
    private String failureMessage;

    BatchJob(String targetCategory, List<UploadItem> items, DedupIndex dedupIndex, List<KnownDocument> knownDocuments) {
        this.targetCategory = targetCategory;
        this.items = List.copyOf(items);
        for (UploadItem item : this.items) {
            itemsByKey.put(item.getEntryKey(), item);
            scopes.put(item.getEntryKey(), new ItemScope());
        }
        this.dedupIndex = Objects.requireNonNull(dedupIndex);
        this.knownDocuments = List.copyOf(knownDocuments);
    }

    public UUID getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getTargetCategory() {
        return targetCategory;
    }

    public BatchState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinished() {
        return getState() != BatchState.RUNNING;
    }

    /**
     * @return aggregate of the current item snapshots
     */
    public BatchSummary summary() {
        BatchState currentState;
        String failure;
        lock.lock();
        try {
            currentState = state;
            failure = failureMessage;
        } finally {
            lock.unlock();
        }
        return BatchSummary.of(id, currentState, failure, itemSnapshots());
    }

    public List<ItemSnapshot> itemSnapshots() {
        List<ItemSnapshot> snapshots = new ArrayList<>(items.size());
        for (UploadItem item : items) {
            snapshots.add(item.snapshot());
        }
        return snapshots;
    }

    public Optional<ItemSnapshot> item(String entryKey) {
        UploadItem item = itemsByKey.get(entryKey);
        return item == null ? Optional.empty() : Optional.of(item.snapshot());
    }

    /**
     * Completes with the final summary once every item is terminal, or exceptionally with
     * {@link BatchAbortedException} when the batch is aborted.
     */
    public CompletableFuture<BatchSummary> settlement() {
        return settlement.thenApply(s -> s);
    }

    public List<ResolutionRequest> openResolutions() {
        lock.lock();
        try {
            List<ResolutionRequest> open = new ArrayList<>();
            for (ResolutionRequest request : openRequests.values()) {
                if (request.isOpen()) {
                    open.add(request);
                }
            }
            return open;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ResolutionRequest> openResolution(ResolutionKind kind) {
        lock.lock();
        try {
            ResolutionRequest request = openRequests.get(kind);
            return request != null && request.isOpen() ? Optional.of(request) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records per-entry decisions ({@code true} = proceed) on the open request of {@code kind}.
     *
     * @return {@code true} if the request is now fully decided
     * @throws ResolutionNotFoundException if no request of that kind is open
     */
    public boolean decide(ResolutionKind kind, Map<String, Boolean> proceedByEntry) {
        return requireOpen(kind).submit(proceedByEntry);
    }

    /**
     * Bulk decision on the open request of {@code kind}.
     *
     * @throws ResolutionNotFoundException if no request of that kind is open
     */
    public boolean decideAll(ResolutionKind kind, boolean proceed) {
        ResolutionRequest request = requireOpen(kind);
        return proceed ? request.proceedAll() : request.skipAll();
    }

    public void addListener(BatchListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(BatchListener listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return "BatchJob{" + id + ", " + items.size() + " items, " + getState() + '}';
    }

    private ResolutionRequest requireOpen(ResolutionKind kind) {
        return openResolution(kind).orElseThrow(() -> new ResolutionNotFoundException(id, kind.wireName()));
    }

    // ---- coordinator side ----

    List<UploadItem> items() {
        return items;
    }

    UploadItem uploadItem(String entryKey) {
        return itemsByKey.get(entryKey);
    }

    DedupIndex dedupIndex() {
        return dedupIndex;
    }

    List<KnownDocument> knownDocuments() {
        return knownDocuments;
    }

    ItemScope scope(String entryKey) {
        return scopes.get(entryKey);
    }

    Iterable<ItemScope> scopes() {
        return scopes.values();
    }

    void holdContent(String entryKey, byte[] content) {
        if (content != null) {
            contents.put(entryKey, content);
        }
    }

    byte[] content(String entryKey) {
        return contents.get(entryKey);
    }

    void releaseContent(String entryKey) {
        contents.remove(entryKey);
    }

    void registerRequest(ResolutionRequest request) {
        lock.lock();
        try {
            ResolutionRequest previous = openRequests.get(request.getKind());
            if (previous != null && previous.isOpen()) {
                throw new IllegalStateException("A " + request.getKind().wireName()
                        + " request is already open in batch " + id);
            }
            openRequests.put(request.getKind(), request);
        } finally {
            lock.unlock();
        }
    }

    void expectGates(int count) {
        pendingGates.set(count);
    }

    /**
     * @return {@code true} for the arrival that released the barrier
     */
    boolean arriveAtGate() {
        return pendingGates.decrementAndGet() == 0;
    }

    void addMismatchCandidate(MismatchCandidate candidate) {
        mismatchCandidates.add(candidate);
    }

    List<MismatchCandidate> drainMismatchCandidates() {
        synchronized (mismatchCandidates) {
            List<MismatchCandidate> drained = new ArrayList<>(mismatchCandidates);
            mismatchCandidates.clear();
            return drained;
        }
    }

    /**
     * @return {@code true} if the status differs from the last one published for this item
     */
    boolean statusChanged(ItemSnapshot snapshot) {
        ItemStatus previous = lastPublishedStatus.put(snapshot.entryKey(), snapshot.status());
        return previous != snapshot.status();
    }

    /**
     * Settles the batch if every item is terminal.
     *
     * @return the final summary when this call settled the batch
     */
    Optional<BatchSummary> settleIfComplete() {
        lock.lock();
        try {
            if (state != BatchState.RUNNING) {
                return Optional.empty();
            }
            for (UploadItem item : items) {
                if (!item.isTerminal()) {
                    return Optional.empty();
                }
            }
            state = BatchState.SETTLED;
        } finally {
            lock.unlock();
        }
        BatchSummary summary = summary();
        settlement.complete(summary);
        return Optional.of(summary);
    }

    /**
     * Aborts the batch: every item that is not terminal yet is skipped with {@code message}
     * before the state leaves {@code running}. An item completing concurrently either finishes
     * first and keeps its outcome, or finds itself skipped.
     *
     * @return the items this call skipped, or empty if the batch had already finished
     */
    Optional<List<UploadItem>> abort(String reason, String message) {
        List<ResolutionRequest> toCancel;
        List<UploadItem> skipped = new ArrayList<>();
        lock.lock();
        try {
            if (state != BatchState.RUNNING) {
                return Optional.empty();
            }
            for (UploadItem item : items) {
                if (item.skip(message)) {
                    skipped.add(item);
                }
            }
            state = BatchState.ABORTED;
            failureMessage = reason;
            toCancel = new ArrayList<>(openRequests.values());
        } finally {
            lock.unlock();
        }
        for (ResolutionRequest request : toCancel) {
            request.cancel(new IllegalStateException("Batch " + id + " aborted"));
        }
        return Optional.of(skipped);
    }

    void failSettlement(BatchAbortedException failure) {
        settlement.completeExceptionally(failure);
    }

    void forEachListener(Consumer<BatchListener> action) {
        for (BatchListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Batch listener {} failed for batch {}: {}", listener.getClass().getSimpleName(), id,
                        e.toString());
            }
        }
    }
}
