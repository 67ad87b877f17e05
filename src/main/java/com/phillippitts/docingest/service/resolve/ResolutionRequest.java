package com.phillippitts.docingest.service.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A consolidated human decision covering every conflict of one kind in a batch.
 *
 * <p>This is a rendezvous: {@link #resolution()} completes only once every entry has a decision,
 * either individually ({@link #decide(String, Decision)}, {@link #submit(Map)}) or in bulk
 * ({@link #proceedAll()}, {@link #skipAll()}). Items waiting on the request stay suspended until
 * then. Decisions recorded before that point may be changed; once resolved the request is
 * immutable.
 *
 * <p>Thread-safe.
 */
public final class ResolutionRequest {

    private final UUID requestId = UUID.randomUUID();
    private final UUID batchId;
    private final ResolutionKind kind;
    private final List<ResolutionCandidate> candidates;
    private final Map<String, ResolutionCandidate> candidatesByKey = new LinkedHashMap<>();

    private final Lock lock = new ReentrantLock();
    private final Map<String, Decision> decisions = new LinkedHashMap<>();
    private final CompletableFuture<Map<String, Decision>> resolution = new CompletableFuture<>();

    public ResolutionRequest(UUID batchId, ResolutionKind kind, List<? extends ResolutionCandidate> candidates) {
        this.batchId = Objects.requireNonNull(batchId, "batchId");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("A resolution request needs at least one candidate");
        }
        this.candidates = List.copyOf(candidates);
        for (ResolutionCandidate candidate : this.candidates) {
            if (candidatesByKey.putIfAbsent(candidate.entryKey(), candidate) != null) {
                throw new IllegalArgumentException("Duplicate entry in request: " + candidate.entryKey());
            }
        }
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public ResolutionKind getKind() {
        return kind;
    }

    public List<ResolutionCandidate> getCandidates() {
        return candidates;
    }

    public List<String> getEntries() {
        return List.copyOf(candidatesByKey.keySet());
    }

    /**
     * Records the decision for one entry.
     *
     * @return {@code true} if this decision completed the request
     * @throws IllegalArgumentException if the entry is not part of this request
     * @throws IllegalStateException if the request is already resolved or cancelled
     */
    public boolean decide(String entryKey, Decision decision) {
        return submit(Map.of(entryKey, decision == Decision.PROCEED));
    }

    /**
     * Records a decisions map ({@code true} = proceed). Entries not mentioned stay pending.
     *
     * @return {@code true} if these decisions completed the request
     * @throws IllegalArgumentException if the map names an entry outside this request
     * @throws IllegalStateException if the request is already resolved or cancelled
     */
    public boolean submit(Map<String, Boolean> proceedByEntry) {
        Objects.requireNonNull(proceedByEntry, "proceedByEntry");
        Map<String, Decision> complete;
        lock.lock();
        try {
            ensureOpen();
            for (String entryKey : proceedByEntry.keySet()) {
                if (!candidatesByKey.containsKey(entryKey)) {
                    throw new IllegalArgumentException("Entry " + entryKey + " is not part of " + kind.wireName()
                            + " request " + requestId);
                }
            }
            proceedByEntry.forEach((entryKey, proceed) -> decisions.put(entryKey, Decision.of(Boolean.TRUE.equals(proceed))));
            if (decisions.size() < candidatesByKey.size()) {
                return false;
            }
            complete = orderedDecisions();
        } finally {
            lock.unlock();
        }
        return resolution.complete(complete);
    }

    /**
     * Bulk decision: every entry proceeds, overriding individual decisions.
     */
    public boolean proceedAll() {
        return decideAll(Decision.PROCEED);
    }

    /**
     * Bulk decision: every entry is skipped, overriding individual decisions.
     */
    public boolean skipAll() {
        return decideAll(Decision.SKIP);
    }

    private boolean decideAll(Decision decision) {
        Map<String, Boolean> all = new LinkedHashMap<>();
        candidatesByKey.keySet().forEach(key -> all.put(key, decision.proceeds()));
        return submit(all);
    }

    /**
     * Abandons the request; waiters see the cause. No-op once resolved.
     */
    public void cancel(Throwable cause) {
        resolution.completeExceptionally(cause);
    }

    /**
     * @return future completed with the full decisions map once every entry is decided
     */
    public CompletableFuture<Map<String, Decision>> resolution() {
        return resolution.thenApply(m -> m);
    }

    /**
     * @return future of the decision for one entry, completed when the whole request resolves
     */
    public CompletableFuture<Decision> decisionFor(String entryKey) {
        if (!candidatesByKey.containsKey(entryKey)) {
            throw new IllegalArgumentException("Entry " + entryKey + " is not part of request " + requestId);
        }
        return resolution.thenApply(m -> m.get(entryKey));
    }

    public boolean isResolved() {
        return resolution.isDone() && !resolution.isCompletedExceptionally();
    }

    public boolean isOpen() {
        return !resolution.isDone();
    }

    /**
     * @return entries still lacking a decision, in candidate order
     */
    public List<String> getPendingEntries() {
        lock.lock();
        try {
            List<String> pending = new ArrayList<>();
            for (String key : candidatesByKey.keySet()) {
                if (!decisions.containsKey(key)) {
                    pending.add(key);
                }
            }
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return decisions recorded so far, in candidate order
     */
    public Map<String, Decision> getDecisions() {
        lock.lock();
        try {
            return orderedDecisions();
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Decision> orderedDecisions() {
        Map<String, Decision> ordered = new LinkedHashMap<>();
        for (String key : candidatesByKey.keySet()) {
            Decision d = decisions.get(key);
            if (d != null) {
                ordered.put(key, d);
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    private void ensureOpen() {
        if (resolution.isDone()) {
            throw new IllegalStateException(kind.wireName() + " request " + requestId
                    + (resolution.isCompletedExceptionally() ? " was cancelled" : " is already resolved"));
        }
    }
}
