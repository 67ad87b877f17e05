package com.phillippitts.docingest.service.registry;

import com.phillippitts.docingest.domain.DocumentCategory;
import com.phillippitts.docingest.domain.KnownDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The externally-visible document list, newest first.
 *
 * <p>Seeded from the existing-documents snapshot and appended to as items succeed. Mutations are
 * expected to arrive through the batch coordinator's serialized mutation path; the internal lock
 * only keeps readers consistent.
 */
@Component
public class DocumentRegistry {

    private final Lock lock = new ReentrantLock();
    private final LinkedList<KnownDocument> documents = new LinkedList<>();

    public void replaceAll(Collection<KnownDocument> snapshot) {
        lock.lock();
        try {
            documents.clear();
            documents.addAll(snapshot);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a document at the head of the list, replacing any entry with the same id.
     */
    public void add(KnownDocument document) {
        lock.lock();
        try {
            if (document.documentId() != null) {
                documents.removeIf(d -> document.documentId().equals(d.documentId()));
            }
            documents.addFirst(document);
        } finally {
            lock.unlock();
        }
    }

    public Optional<KnownDocument> removeById(String documentId) {
        lock.lock();
        try {
            Iterator<KnownDocument> it = documents.iterator();
            while (it.hasNext()) {
                KnownDocument doc = it.next();
                if (documentId != null && documentId.equals(doc.documentId())) {
                    it.remove();
                    return Optional.of(doc);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every document whose normalized category equals {@code category}.
     *
     * @return the removed documents
     */
    public List<KnownDocument> removeByCategory(String category) {
        String normalized = DocumentCategory.normalizeKey(category);
        lock.lock();
        try {
            List<KnownDocument> removed = new ArrayList<>();
            Iterator<KnownDocument> it = documents.iterator();
            while (it.hasNext()) {
                KnownDocument doc = it.next();
                if (normalized.equals(DocumentCategory.normalizeKey(doc.category()))) {
                    it.remove();
                    removed.add(doc);
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<KnownDocument> snapshot() {
        lock.lock();
        try {
            return List.copyOf(documents);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return documents.size();
        } finally {
            lock.unlock();
        }
    }
}
