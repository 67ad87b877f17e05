package com.phillippitts.docingest.service.dedup;

import com.phillippitts.docingest.domain.KnownDocument;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted set of dedup keys for one batch.
 *
 * <p>Seeded from the existing-documents snapshot when a batch starts, appended to as items are
 * accepted, and decremented when the surrounding application deletes documents. Counting keeps
 * a key alive while any document still carries it.
 *
 * <p>Thread-safe. Writers are expected to go through the batch coordinator, which serializes
 * them with the document registry updates.
 */
public final class DedupIndex {

    private final Lock lock = new ReentrantLock();
    private final Map<String, Integer> counts = new HashMap<>();

    /**
     * Builds an index from a document snapshot; documents without a usable name or size are ignored.
     */
    public static DedupIndex fromSnapshot(Collection<KnownDocument> documents) {
        DedupIndex index = new DedupIndex();
        for (KnownDocument doc : documents) {
            index.add(DedupKeyBuilder.keyFor(doc.name(), doc.size()));
        }
        return index;
    }

    public boolean contains(String key) {
        if (key == null) {
            return false;
        }
        lock.lock();
        try {
            return counts.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds one occurrence of {@code key}. Null keys are ignored.
     */
    public void add(String key) {
        if (key == null) {
            return;
        }
        lock.lock();
        try {
            counts.merge(key, 1, Integer::sum);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes one occurrence of {@code key}.
     *
     * @return {@code true} if the key is no longer present
     */
    public boolean remove(String key) {
        if (key == null) {
            return false;
        }
        lock.lock();
        try {
            Integer remaining = counts.computeIfPresent(key, (k, n) -> n > 1 ? n - 1 : null);
            return remaining == null;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return counts.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> keys() {
        lock.lock();
        try {
            return Set.copyOf(counts.keySet());
        } finally {
            lock.unlock();
        }
    }
}
