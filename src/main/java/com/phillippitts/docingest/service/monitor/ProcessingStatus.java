package com.phillippitts.docingest.service.monitor;

import java.util.Locale;

/**
 * One response of the status endpoint.
 *
 * @param state server-side processing state
 * @param progress reported progress, not yet clamped
 * @param processed records processed so far, when reported
 * @param total records expected, when reported
 * @param message server message (error reason for {@code ERROR})
 */
public record ProcessingStatus(State state, int progress, Integer processed, Integer total, String message) {

    public enum State {
        QUEUED, PROCESSING, COMPLETE, ERROR, UNKNOWN;

        /**
         * Maps the status endpoint's string; anything unrecognized is {@link #UNKNOWN}.
         */
        public static State fromWire(String value) {
            if (value == null) {
                return UNKNOWN;
            }
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            if ("COMPLETED".equals(normalized)) {
                return COMPLETE;
            }
            for (State state : values()) {
                if (state.name().equals(normalized)) {
                    return state;
                }
            }
            return UNKNOWN;
        }

        public boolean isTerminal() {
            return this == COMPLETE || this == ERROR;
        }
    }

    public static ProcessingStatus progress(int progress) {
        return new ProcessingStatus(State.PROCESSING, progress, null, null, null);
    }

    public static ProcessingStatus complete() {
        return new ProcessingStatus(State.COMPLETE, 100, null, null, null);
    }

    public static ProcessingStatus error(String message) {
        return new ProcessingStatus(State.ERROR, 0, null, null, message);
    }

    /**
     * Message shown on the item while processing, e.g. {@code Processing… 120/400 records}.
     */
    public String describe() {
        if (processed != null && total != null && total > 0) {
            return "Processing… " + processed + "/" + total + " records";
        }
        return "Processing… " + Math.max(0, Math.min(progress, 100)) + "%";
    }
}
