package com.phillippitts.docingest.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of document categories the backend knows how to import, with the file extensions
 * each one accepts.
 *
 * <p>Category keys travel as plain strings (the classifier may return keys this catalog does
 * not list); use {@link #normalizeKey(String)} before comparing any two keys.
 */
public enum DocumentCategory {
    BANK_STATEMENT_DKB("bank_statement_dkb", Set.of("csv")),
    BANK_STATEMENT_YUH("bank_statement_yuh", Set.of("csv")),
    BROKER_ING_DIBA_CSV("broker_ing_diba_csv", Set.of("csv", "pdf")),
    BROKER_VIAC_PDF("broker_viac_pdf", Set.of("pdf")),
    LOAN_KFW_PDF("loan_kfw_pdf", Set.of("pdf"));

    public static final String UNKNOWN = "unknown";

    private final String key;
    private final Set<String> extensions;

    DocumentCategory(String key, Set<String> extensions) {
        this.key = key;
        this.extensions = extensions;
    }

    public String key() {
        return key;
    }

    public boolean accepts(String extension) {
        return extension != null && extensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Trims and lowercases a category key; blank or null becomes {@value #UNKNOWN}.
     */
    public static String normalizeKey(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? UNKNOWN : trimmed;
    }

    /**
     * Looks up a catalog entry by (normalized) key.
     */
    public static Optional<DocumentCategory> fromKey(String value) {
        String normalized = normalizeKey(value);
        for (DocumentCategory category : values()) {
            if (category.key.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
