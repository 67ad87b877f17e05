package com.phillippitts.docingest.exception;

/**
 * Thrown when the status endpoint reports that server-side processing of an upload failed.
 * The message is the one supplied by the server.
 */
public class ProcessingFailedException extends DocIngestException {

    private final String uploadId;

    public ProcessingFailedException(String uploadId, String serverMessage) {
        super(serverMessage == null || serverMessage.isBlank() ? "Processing failed" : serverMessage);
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
