package com.phillippitts.docingest.exception;

/**
 * Thrown when a call to the ingestion backend fails at the transport level or returns an
 * unexpected status. Used for transfers, status polls, classification and deletion calls.
 */
public class TransferException extends DocIngestException {

    private final String operation;
    private final int httpStatus;

    public TransferException(String message) {
        super(message);
        this.operation = "unknown";
        this.httpStatus = 0;
    }

    public TransferException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
        this.httpStatus = 0;
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
        this.operation = "unknown";
        this.httpStatus = 0;
    }

    public TransferException(String message, String operation, int httpStatus, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return HTTP status returned by the backend, or 0 when no response was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
