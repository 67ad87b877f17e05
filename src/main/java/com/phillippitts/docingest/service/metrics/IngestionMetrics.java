package com.phillippitts.docingest.service.metrics;

import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.service.monitor.PollExhaustionPolicy;
import com.phillippitts.docingest.service.resolve.Decision;
import com.phillippitts.docingest.service.resolve.ResolutionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for batch ingestion.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>terminal item outcomes by status</li>
 *   <li>human decisions by resolution kind</li>
 *   <li>poll loops that hit the attempt ceiling</li>
 *   <li>transfer and processing latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class IngestionMetrics {

    private static final String METRIC_PREFIX = "docingest";

    private final MeterRegistry registry;

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts an item that reached a terminal status.
     */
    public void recordOutcome(ItemStatus status) {
        Counter.builder(METRIC_PREFIX + ".item.outcome")
                .description("Items that reached a terminal status")
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }

    public void recordDecision(ResolutionKind kind, Decision decision) {
        Counter.builder(METRIC_PREFIX + ".resolution.decision")
                .description("Human decisions on duplicate and mismatch conflicts")
                .tag("kind", kind.wireName())
                .tag("decision", decision.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordPollExhausted(PollExhaustionPolicy policy) {
        Counter.builder(METRIC_PREFIX + ".poll.exhausted")
                .description("Poll loops that reached the attempt ceiling")
                .tag("policy", policy.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementBatchAborted() {
        Counter.builder(METRIC_PREFIX + ".batch.aborted")
                .description("Batches aborted by an authentication failure")
                .register(registry)
                .increment();
    }

    public void recordTransferLatency(long millis) {
        Timer.builder(METRIC_PREFIX + ".transfer.latency")
                .description("Time taken to transfer one file")
                .register(registry)
                .record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordProcessingLatency(long millis) {
        Timer.builder(METRIC_PREFIX + ".processing.latency")
                .description("Time from transfer completion to terminal processing status")
                .register(registry)
                .record(millis, TimeUnit.MILLISECONDS);
    }
}
