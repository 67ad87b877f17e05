package com.phillippitts.docingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse state of a batch.
 */
public enum BatchState {
    RUNNING("running"),
    SETTLED("settled"),
    ABORTED("aborted");

    private final String wireName;

    BatchState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
