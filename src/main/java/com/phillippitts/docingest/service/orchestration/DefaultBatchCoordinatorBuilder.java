package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.service.detect.TypeDetector;
import com.phillippitts.docingest.service.metrics.IngestionMetrics;
import com.phillippitts.docingest.service.monitor.ProcessingMonitor;
import com.phillippitts.docingest.service.registry.DocumentRegistry;
import com.phillippitts.docingest.service.registry.ExistingDocumentsSource;
import com.phillippitts.docingest.service.resolve.CategoryMismatchResolver;
import com.phillippitts.docingest.service.resolve.DuplicateResolver;
import com.phillippitts.docingest.service.transfer.TransferClient;
import com.phillippitts.docingest.service.transfer.TransferTimeoutPolicy;
import com.phillippitts.docingest.service.validation.FileValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.util.Objects;

/**
 * Builder for {@link DefaultBatchCoordinator}, which has too many collaborators for a readable
 * constructor call.
 *
 * <pre>{@code
 * BatchCoordinator coordinator = DefaultBatchCoordinatorBuilder.builder()
 *     .validator(validator)
 *     .typeDetector(detector)
 *     .duplicateResolver(duplicates)
 *     .mismatchResolver(mismatches)
 *     .transferClient(client)
 *     .timeoutPolicy(timeouts)
 *     .monitor(monitor)
 *     .existingDocuments(source)
 *     .registry(registry)
 *     .executor(ingestExecutor)
 *     .transferExecutor(transferExecutor)
 *     .scheduler(pollScheduler)
 *     .properties(props)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 * Metrics are optional; without them a private in-memory registry is used (for tests).
 */
public final class DefaultBatchCoordinatorBuilder {

    private FileValidator validator;
    private TypeDetector typeDetector;
    private DuplicateResolver duplicateResolver;
    private CategoryMismatchResolver mismatchResolver;
    private TransferClient transferClient;
    private TransferTimeoutPolicy timeoutPolicy;
    private ProcessingMonitor monitor;
    private ExistingDocumentsSource existingDocuments;
    private DocumentRegistry registry;
    private AsyncTaskExecutor executor;
    private AsyncTaskExecutor transferExecutor;
    private TaskScheduler scheduler;
    private IngestionProperties properties;
    private IngestionMetrics metrics;
    private ApplicationEventPublisher publisher;

    private DefaultBatchCoordinatorBuilder() {
    }

    public static DefaultBatchCoordinatorBuilder builder() {
        return new DefaultBatchCoordinatorBuilder();
    }

    public DefaultBatchCoordinatorBuilder validator(FileValidator validator) {
        this.validator = validator;
        return this;
    }

    public DefaultBatchCoordinatorBuilder typeDetector(TypeDetector typeDetector) {
        this.typeDetector = typeDetector;
        return this;
    }

    public DefaultBatchCoordinatorBuilder duplicateResolver(DuplicateResolver duplicateResolver) {
        this.duplicateResolver = duplicateResolver;
        return this;
    }

    public DefaultBatchCoordinatorBuilder mismatchResolver(CategoryMismatchResolver mismatchResolver) {
        this.mismatchResolver = mismatchResolver;
        return this;
    }

    public DefaultBatchCoordinatorBuilder transferClient(TransferClient transferClient) {
        this.transferClient = transferClient;
        return this;
    }

    public DefaultBatchCoordinatorBuilder timeoutPolicy(TransferTimeoutPolicy timeoutPolicy) {
        this.timeoutPolicy = timeoutPolicy;
        return this;
    }

    public DefaultBatchCoordinatorBuilder monitor(ProcessingMonitor monitor) {
        this.monitor = monitor;
        return this;
    }

    public DefaultBatchCoordinatorBuilder existingDocuments(ExistingDocumentsSource existingDocuments) {
        this.existingDocuments = existingDocuments;
        return this;
    }

    public DefaultBatchCoordinatorBuilder registry(DocumentRegistry registry) {
        this.registry = registry;
        return this;
    }

    /**
     * @param executor pool for detection and pipeline continuations
     */
    public DefaultBatchCoordinatorBuilder executor(AsyncTaskExecutor executor) {
        this.executor = executor;
        return this;
    }

    /**
     * @param transferExecutor pool running the blocking uploads
     */
    public DefaultBatchCoordinatorBuilder transferExecutor(AsyncTaskExecutor transferExecutor) {
        this.transferExecutor = transferExecutor;
        return this;
    }

    /**
     * @param scheduler scheduler for transfer deadlines
     */
    public DefaultBatchCoordinatorBuilder scheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public DefaultBatchCoordinatorBuilder properties(IngestionProperties properties) {
        this.properties = properties;
        return this;
    }

    public DefaultBatchCoordinatorBuilder metrics(IngestionMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public DefaultBatchCoordinatorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     */
    public DefaultBatchCoordinator build() {
        Objects.requireNonNull(validator, "validator is required");
        Objects.requireNonNull(typeDetector, "typeDetector is required");
        Objects.requireNonNull(duplicateResolver, "duplicateResolver is required");
        Objects.requireNonNull(mismatchResolver, "mismatchResolver is required");
        Objects.requireNonNull(transferClient, "transferClient is required");
        Objects.requireNonNull(timeoutPolicy, "timeoutPolicy is required");
        Objects.requireNonNull(monitor, "monitor is required");
        Objects.requireNonNull(existingDocuments, "existingDocuments is required");
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(transferExecutor, "transferExecutor is required");
        Objects.requireNonNull(scheduler, "scheduler is required");
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(publisher, "publisher is required");

        IngestionMetrics effectiveMetrics = metrics != null ? metrics : new IngestionMetrics(new SimpleMeterRegistry());

        return new DefaultBatchCoordinator(validator, typeDetector, duplicateResolver, mismatchResolver,
                transferClient, timeoutPolicy, monitor, existingDocuments, registry, executor, transferExecutor,
                scheduler, properties, effectiveMetrics, publisher);
    }
}
