package com.phillippitts.docingest.exception;

/**
 * Root of the unchecked failures raised while ingesting batches or talking to the document
 * backend. {@code GlobalExceptionHandler} maps each subtype to an HTTP status.
 */
public class DocIngestException extends RuntimeException {

    public DocIngestException(String message) {
        super(message);
    }

    public DocIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
