package com.phillippitts.docingest.service.resolve;

import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.service.dedup.DedupIndex;
import com.phillippitts.docingest.service.dedup.DedupKeyBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds duplicate conflicts in a batch and consolidates them into one request.
 *
 * <p>Two conflict sources are collected in a single pass over the items in submission order:
 * <ul>
 *   <li><b>batch-internal</b>: a later file whose dedup key matches an earlier file of the same
 *       batch (the first occurrence is never flagged for this reason)</li>
 *   <li><b>existing-document</b>: a file whose dedup key is already in the batch's {@link DedupIndex}</li>
 * </ul>
 * A file matching both reports the batch-internal collision. Items without a dedup key never
 * conflict.
 */
@Component
public class DuplicateResolver {

    private static final Logger LOG = LogManager.getLogger(DuplicateResolver.class);

    /**
     * @param items batch items in submission order (terminal items are ignored)
     * @param index dedup keys of documents the backend already holds
     * @param existing snapshot used to name the matching documents
     * @return conflicts in submission order, empty when there are none
     */
    public List<DuplicateCandidate> findConflicts(List<UploadItem> items, DedupIndex index,
                                                  Collection<KnownDocument> existing) {
        Map<String, String> firstEntryByKey = new HashMap<>();
        List<DuplicateCandidate> conflicts = new ArrayList<>();
        for (UploadItem item : items) {
            String key = item.getDedupKey();
            if (key == null || item.isTerminal()) {
                continue;
            }
            String earlier = firstEntryByKey.putIfAbsent(key, item.getEntryKey());
            if (earlier != null) {
                conflicts.add(new DuplicateCandidate(item.getEntryKey(), item.getFileName(),
                        DuplicateCandidate.Source.BATCH, List.of(earlier)));
            } else if (index.contains(key)) {
                conflicts.add(new DuplicateCandidate(item.getEntryKey(), item.getFileName(),
                        DuplicateCandidate.Source.EXISTING, matchingNames(key, existing)));
            }
        }
        LOG.debug("Duplicate scan: {} conflicts among {} items", conflicts.size(), items.size());
        return conflicts;
    }

    /**
     * Opens the consolidated request, or returns empty when there is nothing to decide.
     */
    public Optional<ResolutionRequest> open(UUID batchId, List<DuplicateCandidate> conflicts) {
        if (conflicts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResolutionRequest(batchId, ResolutionKind.DUPLICATE, conflicts));
    }

    /**
     * Ends a waiting item as a skipped duplicate.
     *
     * @return {@code true} if this call ended the item
     */
    public boolean skip(UploadItem item) {
        return item.skip("Skipped: duplicate document");
    }

    private static List<String> matchingNames(String key, Collection<KnownDocument> existing) {
        List<String> names = new ArrayList<>();
        for (KnownDocument doc : existing) {
            if (key.equals(DedupKeyBuilder.keyFor(doc.name(), doc.size()))) {
                names.add(doc.name());
            }
        }
        return names;
    }
}
