package com.phillippitts.docingest.config.orchestration;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.service.detect.TypeDetector;
import com.phillippitts.docingest.service.metrics.IngestionMetrics;
import com.phillippitts.docingest.service.monitor.ProcessingMonitor;
import com.phillippitts.docingest.service.orchestration.BatchCoordinator;
import com.phillippitts.docingest.service.orchestration.DefaultBatchCoordinatorBuilder;
import com.phillippitts.docingest.service.registry.DocumentRegistry;
import com.phillippitts.docingest.service.registry.ExistingDocumentsSource;
import com.phillippitts.docingest.service.resolve.CategoryMismatchResolver;
import com.phillippitts.docingest.service.resolve.DuplicateResolver;
import com.phillippitts.docingest.service.transfer.TransferClient;
import com.phillippitts.docingest.service.transfer.TransferTimeoutPolicy;
import com.phillippitts.docingest.service.validation.FileValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the batch coordinator explicitly so that it gets the named ingest pools.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public BatchCoordinator batchCoordinator(FileValidator validator,
                                             TypeDetector typeDetector,
                                             DuplicateResolver duplicateResolver,
                                             CategoryMismatchResolver mismatchResolver,
                                             TransferClient transferClient,
                                             TransferTimeoutPolicy timeoutPolicy,
                                             ProcessingMonitor monitor,
                                             ExistingDocumentsSource existingDocuments,
                                             DocumentRegistry registry,
                                             @Qualifier("ingestExecutor") ThreadPoolTaskExecutor executor,
                                             @Qualifier("transferExecutor") ThreadPoolTaskExecutor transferExecutor,
                                             @Qualifier("pollScheduler") ThreadPoolTaskScheduler scheduler,
                                             IngestionProperties properties,
                                             IngestionMetrics metrics,
                                             ApplicationEventPublisher publisher) {
        return DefaultBatchCoordinatorBuilder.builder()
                .validator(validator)
                .typeDetector(typeDetector)
                .duplicateResolver(duplicateResolver)
                .mismatchResolver(mismatchResolver)
                .transferClient(transferClient)
                .timeoutPolicy(timeoutPolicy)
                .monitor(monitor)
                .existingDocuments(existingDocuments)
                .registry(registry)
                .executor(executor)
                .transferExecutor(transferExecutor)
                .scheduler(scheduler)
                .properties(properties)
                .metrics(metrics)
                .publisher(publisher)
                .build();
    }
}
