package com.phillippitts.docingest.service.detect;

import com.phillippitts.docingest.domain.DocumentCategory;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.util.LogSanitizer;
import com.phillippitts.docingest.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the external classifier for one file at a time, asynchronously.
 *
 * <p><b>Thread Model:</b> every call to {@link #detectAsync(String, byte[])} submits its own task
 * to the ingest executor, so a batch fans out with no cap beyond the pool and the transport.
 *
 * <p><b>Error Handling:</b> a classifier failure for one file degrades to {@code null} (unknown)
 * for that file only and never fails the returned future. The exception is
 * {@link AuthFailureException}: a rejected credential invalidates the whole batch, so it
 * completes the future exceptionally for the coordinator to act on.
 */
@Service
public class TypeDetector {

    private static final Logger LOG = LogManager.getLogger(TypeDetector.class);

    private final DocumentClassifier classifier;
    private final Executor executor;

    public TypeDetector(DocumentClassifier classifier, @Qualifier("ingestExecutor") Executor executor) {
        this.classifier = Objects.requireNonNull(classifier);
        this.executor = Objects.requireNonNull(executor);
    }

    /**
     * @return future of the normalized category key, or of {@code null} when unknown
     */
    public CompletableFuture<String> detectAsync(String fileName, byte[] content) {
        return CompletableFuture.supplyAsync(() -> detect(fileName, content), executor);
    }

    /**
     * Synchronous variant used by {@link #detectAsync(String, byte[])}.
     */
    public String detect(String fileName, byte[] content) {
        long t0 = System.nanoTime();
        try {
            String raw = classifier.classify(fileName, content);
            if (raw == null || raw.isBlank()) {
                LOG.debug("Classifier did not recognize {}", LogSanitizer.fileName(fileName));
                return null;
            }
            String category = DocumentCategory.normalizeKey(raw);
            LOG.debug("Detected {} as {} in {} ms", LogSanitizer.fileName(fileName), category,
                    TimeUtils.elapsedMillis(t0));
            return DocumentCategory.UNKNOWN.equals(category) ? null : category;
        } catch (AuthFailureException auth) {
            throw auth;
        } catch (RuntimeException e) {
            LOG.warn("Type detection failed for {}; treating as unknown: {}",
                    LogSanitizer.fileName(fileName), e.getMessage());
            return null;
        }
    }
}
