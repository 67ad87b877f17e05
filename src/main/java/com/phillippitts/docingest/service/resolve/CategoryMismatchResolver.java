package com.phillippitts.docingest.service.resolve;

import com.phillippitts.docingest.domain.DocumentCategory;
import com.phillippitts.docingest.domain.UploadItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Detects and settles disagreements between the classifier and the user's selected category.
 *
 * <p>An item mismatches when its detected category is known and differs from its target
 * category after key normalization. An unknown detection never mismatches.
 */
@Component
public class CategoryMismatchResolver {

    public boolean isMismatch(UploadItem item) {
        String detected = item.getDetectedCategory();
        if (detected == null) {
            return false;
        }
        return !DocumentCategory.normalizeKey(detected).equals(DocumentCategory.normalizeKey(item.getTargetCategory()));
    }

    public MismatchCandidate candidateFor(UploadItem item) {
        return new MismatchCandidate(item.getEntryKey(), item.getFileName(), item.getTargetCategory(),
                item.getDetectedCategory());
    }

    /**
     * Opens the consolidated request, or returns empty when there is nothing to decide.
     */
    public Optional<ResolutionRequest> open(UUID batchId, List<MismatchCandidate> candidates) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResolutionRequest(batchId, ResolutionKind.MISMATCH, candidates));
    }

    /**
     * Applies a decision: proceed moves the item to its detected category, skip ends it.
     *
     * @return {@code true} if the item continues to upload
     */
    public boolean apply(UploadItem item, Decision decision) {
        if (!decision.proceeds()) {
            item.skip("Skipped: category mismatch");
            return false;
        }
        if (item.isTerminal()) {
            return false;
        }
        item.retarget(item.getDetectedCategory());
        return true;
    }
}
