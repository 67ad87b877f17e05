package com.phillippitts.docingest.service.metrics;

import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.service.monitor.PollExhaustionPolicy;
import com.phillippitts.docingest.service.resolve.Decision;
import com.phillippitts.docingest.service.resolve.ResolutionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionMetricsTest {

    private MeterRegistry registry;
    private IngestionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new IngestionMetrics(registry);
    }

    @Test
    void shouldCountOutcomesPerStatus() {
        metrics.recordOutcome(ItemStatus.SUCCESS);
        metrics.recordOutcome(ItemStatus.SUCCESS);
        metrics.recordOutcome(ItemStatus.SKIPPED);

        Counter success = registry.find("docingest.item.outcome").tag("status", "success").counter();
        Counter skipped = registry.find("docingest.item.outcome").tag("status", "skipped").counter();

        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(2.0);
        assertThat(skipped.count()).isEqualTo(1.0);
        assertThat(registry.find("docingest.item.outcome").tag("status", "error").counter()).isNull();
    }

    @Test
    void shouldTagDecisionsByKindAndChoice() {
        metrics.recordDecision(ResolutionKind.DUPLICATE, Decision.SKIP);
        metrics.recordDecision(ResolutionKind.MISMATCH, Decision.PROCEED);

        assertThat(registry.find("docingest.resolution.decision")
                .tags("kind", "duplicate", "decision", "skip").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("docingest.resolution.decision")
                .tags("kind", "mismatch", "decision", "proceed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountExhaustedPollsByPolicy() {
        metrics.recordPollExhausted(PollExhaustionPolicy.FORCED_SUCCESS);

        Counter counter = registry.find("docingest.poll.exhausted").tag("policy", "forced_success").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountAbortedBatches() {
        metrics.incrementBatchAborted();
        metrics.incrementBatchAborted();

        assertThat(registry.find("docingest.batch.aborted").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldRecordTransferAndProcessingLatency() {
        metrics.recordTransferLatency(120);
        metrics.recordTransferLatency(80);
        metrics.recordProcessingLatency(1500);

        Timer transfer = registry.find("docingest.transfer.latency").timer();
        Timer processing = registry.find("docingest.processing.latency").timer();

        assertThat(transfer).isNotNull();
        assertThat(transfer.count()).isEqualTo(2);
        assertThat(transfer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200);
        assertThat(processing.count()).isEqualTo(1);
        assertThat(processing.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500);
    }
}
