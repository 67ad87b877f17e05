package com.phillippitts.docingest.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link TransferException} with contextual information.
 *
 * <p>Keeps failure messages of the backend clients consistent:
 * <pre>
 * throw TransferExceptionBuilder.create("Transfer failed")
 *         .operation("transfer")
 *         .httpStatus(502)
 *         .durationMs(1500)
 *         .metadata("uploadId", uploadId)
 *         .cause(ex)
 *         .build();
 * </pre>
 */
public final class TransferExceptionBuilder {

    private final String message;
    private String operation;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TransferExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TransferExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TransferExceptionBuilder(message);
    }

    /**
     * @param operation backend operation name (e.g., "transfer", "status", "classify")
     * @return this builder for chaining
     */
    public TransferExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public TransferExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TransferExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public TransferExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TransferExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (httpStatus={code}, durationMs={ms}, {key1}={val1}, ...) (operation: {operation})
     * </pre>
     *
     * @return constructed TransferException
     */
    public TransferException build() {
        String op = operation != null ? operation : "unknown";
        int status = httpStatus != null ? httpStatus : 0;
        return new TransferException(buildDetailedMessage(), op, status, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (httpStatus != null) {
            sb.append("httpStatus=").append(httpStatus);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
