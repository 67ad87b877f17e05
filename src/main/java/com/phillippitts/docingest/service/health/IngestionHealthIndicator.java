package com.phillippitts.docingest.service.health;

import com.phillippitts.docingest.service.orchestration.BatchCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for batch ingestion.
 *
 * <p>Reports {@code DOWN} with {@code authRequired=true} after the backend rejected the session
 * credential, until a later submission succeeds. Also reports the number of running batches.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final BatchCoordinator coordinator;

    public IngestionHealthIndicator(BatchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        boolean authRequired = coordinator.isAuthRequired();
        Health.Builder builder = authRequired ? Health.down() : Health.up();
        return builder
                .withDetail("authRequired", authRequired)
                .withDetail("activeBatches", coordinator.activeBatchCount())
                .build();
    }
}
