package com.phillippitts.docingest.service.resolve;

/**
 * A file the classifier assigned to a different category than the one the user selected.
 *
 * @param entryKey conflicted entry
 * @param fileName its display name
 * @param selectedCategory category the user selected
 * @param detectedCategory category the classifier returned
 */
public record MismatchCandidate(String entryKey, String fileName, String selectedCategory, String detectedCategory)
        implements ResolutionCandidate {
}
