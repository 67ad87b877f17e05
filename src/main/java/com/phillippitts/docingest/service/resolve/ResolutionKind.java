package com.phillippitts.docingest.service.resolve;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of consolidated human decision a batch can wait on. At most one request per kind is open
 * per batch.
 */
public enum ResolutionKind {
    DUPLICATE("duplicate"),
    MISMATCH("mismatch");

    private final String wireName;

    ResolutionKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static ResolutionKind fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ResolutionKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown resolution kind: " + value);
    }
}
