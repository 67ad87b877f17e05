package com.phillippitts.docingest.service.monitor;

/**
 * What happens to an item whose status polling reached the attempt ceiling without a terminal
 * server status.
 */
public enum PollExhaustionPolicy {
    /** Item ends in {@code success} with a degraded-confidence message. */
    FORCED_SUCCESS,
    /** Item ends in {@code error}. */
    TIMEOUT_ERROR
}
