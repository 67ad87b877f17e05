package com.phillippitts.docingest.exception;

/**
 * Thrown when a submitted file cannot be ingested at all: missing name, zero or negative size,
 * an extension that is not accepted, or a payload over the configured size limit.
 */
public class InvalidFileException extends DocIngestException {

    private final String fileName;
    private final String reason;

    public InvalidFileException(String reason) {
        super("Invalid file: " + reason);
        this.fileName = null;
        this.reason = reason;
    }

    public InvalidFileException(String fileName, String reason) {
        super("Invalid file (" + fileName + "): " + reason);
        this.fileName = fileName;
        this.reason = reason;
    }

    public String getFileName() {
        return fileName;
    }

    public String getReason() {
        return reason;
    }
}
