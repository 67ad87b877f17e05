package com.phillippitts.docingest.client;

import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;
import com.phillippitts.docingest.exception.TransferExceptionBuilder;
import com.phillippitts.docingest.service.detect.DocumentClassifier;
import com.phillippitts.docingest.service.monitor.ProcessingStatus;
import com.phillippitts.docingest.service.monitor.StatusClient;
import com.phillippitts.docingest.service.registry.DocumentDeletionClient;
import com.phillippitts.docingest.service.registry.ExistingDocumentsSource;
import com.phillippitts.docingest.service.transfer.TransferClient;
import com.phillippitts.docingest.service.transfer.TransferReceipt;
import com.phillippitts.docingest.service.transfer.TransferRequest;
import com.phillippitts.docingest.util.LogSanitizer;
import com.phillippitts.docingest.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST adapter for the ingestion backend.
 *
 * <p>Endpoints (relative to {@code ingest.api.base-url}):
 * <ul>
 *   <li>{@code GET /api/documents}: existing-documents snapshot</li>
 *   <li>{@code POST /api/documents/detect-type}: classifier (multipart {@code file})</li>
 *   <li>{@code POST /api/documents/upload}: transfer (multipart {@code file}, {@code documentType},
 *       {@code uploadId})</li>
 *   <li>{@code GET /api/upload-progress/{uploadId}}: processing status</li>
 *   <li>{@code DELETE /api/documents/{id}} and {@code DELETE /api/documents/by-type/{type}}</li>
 * </ul>
 *
 * <p>HTTP 401/403 from any endpoint becomes {@link AuthFailureException}; every other failure
 * becomes {@link TransferException}. Server error bodies are not copied into messages.
 */
@Component
public class RestDocumentApiClient implements DocumentClassifier, TransferClient, StatusClient,
        ExistingDocumentsSource, DocumentDeletionClient {

    private static final Logger LOG = LogManager.getLogger(RestDocumentApiClient.class);

    private final RestClient apiClient;
    private final RestClient transferClient;

    public RestDocumentApiClient(@Qualifier("apiRestClient") RestClient apiClient,
                                 @Qualifier("transferRestClient") RestClient transferClient) {
        this.apiClient = apiClient;
        this.transferClient = transferClient;
    }

    @Override
    public String classify(String fileName, byte[] content) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new NamedBytes(content, fileName, null));
        DetectResponse response = call("classify", null, () -> apiClient.post()
                .uri("/api/documents/detect-type")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(body.build())
                .retrieve()
                .body(DetectResponse.class));
        return response == null ? null : response.documentType();
    }

    @Override
    public TransferReceipt transfer(TransferRequest request, ProgressListener progress) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new NamedBytes(request.content(), request.fileName(), progress));
        body.part("documentType", request.targetCategory());
        body.part("uploadId", request.uploadId());
        long t0 = System.nanoTime();
        UploadResponse response = call("transfer", request.uploadId(), () -> transferClient.post()
                .uri("/api/documents/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(body.build())
                .retrieve()
                .body(UploadResponse.class));
        if (response == null || response.document() == null || response.document().id() == null) {
            throw TransferExceptionBuilder.create("Upload response carried no document id")
                    .operation("transfer")
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("uploadId", request.uploadId())
                    .build();
        }
        LOG.debug("Uploaded {} as document {}", LogSanitizer.fileName(request.fileName()), response.document().id());
        return new TransferReceipt(response.document().id(), response.importSummary());
    }

    @Override
    public ProcessingStatus status(String uploadId) {
        ProgressResponse response = call("status", uploadId, () -> apiClient.get()
                .uri("/api/upload-progress/{uploadId}", uploadId)
                .retrieve()
                .body(ProgressResponse.class));
        if (response == null) {
            return new ProcessingStatus(ProcessingStatus.State.UNKNOWN, 0, null, null, null);
        }
        int progress;
        if (response.progress() != null) {
            progress = response.progress();
        } else if (response.processed() != null && response.total() != null && response.total() > 0) {
            progress = (int) (response.processed() * 100L / response.total());
        } else {
            progress = 0;
        }
        return new ProcessingStatus(ProcessingStatus.State.fromWire(response.status()), progress,
                response.processed(), response.total(), response.message());
    }

    @Override
    public List<KnownDocument> listDocuments() {
        DocumentsResponse response = call("list", null, () -> apiClient.get()
                .uri("/api/documents")
                .retrieve()
                .body(DocumentsResponse.class));
        List<KnownDocument> documents = new ArrayList<>();
        if (response != null && response.documents() != null) {
            for (DocumentPayload doc : response.documents()) {
                documents.add(new KnownDocument(doc.id(), doc.originalName(), doc.fileSize(), doc.documentType()));
            }
        }
        LOG.debug("Backend lists {} documents", documents.size());
        return documents;
    }

    @Override
    public void deleteDocument(String documentId) {
        call("delete", null, () -> apiClient.delete()
                .uri("/api/documents/{id}", documentId)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public int deleteByCategory(String category) {
        DeleteResponse response = call("deleteByCategory", null, () -> apiClient.delete()
                .uri("/api/documents/by-type/{type}", category)
                .retrieve()
                .body(DeleteResponse.class));
        return response == null || response.deleted_count() == null ? 0 : response.deleted_count();
    }

    private static <T> T call(String operation, String uploadId, Supplier<T> request) {
        long t0 = System.nanoTime();
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                throw new AuthFailureException(operation, e);
            }
            throw TransferExceptionBuilder.create("Backend rejected " + operation)
                    .operation(operation)
                    .httpStatus(status)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("uploadId", uploadId)
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw TransferExceptionBuilder.create("Backend unreachable during " + operation)
                    .operation(operation)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("uploadId", uploadId)
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw TransferExceptionBuilder.create("Backend call failed: " + operation)
                    .operation(operation)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("uploadId", uploadId)
                    .cause(e)
                    .build();
        }
    }

    /**
     * File part with a name and, optionally, read progress reporting. The multipart writer
     * streams the part from {@link #getInputStream()}, so bytes read approximate bytes sent.
     */
    static final class NamedBytes extends ByteArrayResource {

        private final String fileName;
        private final ProgressListener progress;

        NamedBytes(byte[] content, String fileName, ProgressListener progress) {
            super(content == null ? new byte[0] : content);
            this.fileName = fileName;
            this.progress = progress;
        }

        @Override
        public String getFilename() {
            return fileName;
        }

        @Override
        public InputStream getInputStream() throws IOException {
            InputStream raw = super.getInputStream();
            if (progress == null) {
                return raw;
            }
            long total = contentLength();
            return new FilterInputStream(raw) {
                private long sent;

                @Override
                public int read() throws IOException {
                    int b = super.read();
                    if (b >= 0) {
                        advance(1);
                    }
                    return b;
                }

                @Override
                public int read(byte[] buf, int off, int len) throws IOException {
                    int n = super.read(buf, off, len);
                    if (n > 0) {
                        advance(n);
                    }
                    return n;
                }

                private void advance(int n) {
                    sent += n;
                    progress.onBytesSent(sent, total);
                }
            };
        }

        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    record DetectResponse(Boolean success, String documentType, String filename) {}

    record UploadResponse(Boolean success, DocumentPayload document, String importSummary) {}

    record DocumentPayload(String id, String documentType, String originalName, Long fileSize,
                           Map<String, Object> documentMetadata) {}

    record DocumentsResponse(Boolean success, List<DocumentPayload> documents) {}

    record ProgressResponse(String status, Integer progress, Integer processed, Integer total, String message) {}

    record DeleteResponse(Boolean success, Integer deleted_count) {}
}
