package com.phillippitts.docingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of one {@link UploadItem}.
 *
 * <p>Declaration order is the forward order of the state machine. A status may only move
 * forward along this order, except into {@link #ERROR} or {@link #SKIPPED}, which are terminal
 * exits reachable from any non-terminal status.
 * <pre>
 * QUEUED → DETECTING → [AWAITING_DUPLICATE_DECISION] → [AWAITING_MISMATCH_DECISION]
 *        → UPLOADING → PROCESSING → SUCCESS
 * </pre>
 */
public enum ItemStatus {
    QUEUED("queued"),
    DETECTING("detecting"),
    AWAITING_DUPLICATE_DECISION("awaiting_duplicate_decision"),
    AWAITING_MISMATCH_DECISION("awaiting_mismatch_decision"),
    UPLOADING("uploading"),
    PROCESSING("processing"),
    SUCCESS("success"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String wireName;

    ItemStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == SKIPPED;
    }

    /**
     * @return true when the state machine allows moving from this status to {@code next}
     */
    public boolean canTransitionTo(ItemStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ERROR || next == SKIPPED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
