package com.phillippitts.docingest.exception;

/**
 * Thrown when the backend rejects the session credential on any call.
 *
 * <p>Unlike every other failure this one is not isolated to a single item: it invalidates all
 * outstanding requests of the batch, so the coordinator aborts the whole batch when it sees it.
 */
public class AuthFailureException extends DocIngestException {

    private final String operation;

    public AuthFailureException(String operation) {
        super("Authentication required (operation: " + operation + ")");
        this.operation = operation;
    }

    public AuthFailureException(String operation, Throwable cause) {
        super("Authentication required (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
