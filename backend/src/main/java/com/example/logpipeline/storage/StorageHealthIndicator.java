package com.example.logpipeline.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the configured default backend's own liveness probe.
 */
@Slf4j
@Component("storage")
public class StorageHealthIndicator implements HealthIndicator {

    private final StorageBackendSelector storageBackendSelector;

    public StorageHealthIndicator(StorageBackendSelector storageBackendSelector) {
        this.storageBackendSelector = storageBackendSelector;
    }

    @Override
    public Health health() {
        String backendName = storageBackendSelector.defaultType().backendName();
        try {
            if (storageBackendSelector.getDefault().healthCheck()) {
                return Health.up().withDetail("backend", backendName).build();
            }
            return Health.down().withDetail("backend", backendName).build();
        } catch (Exception e) {
            log.error("Storage health check failed: backend={}, error={}", backendName, e.getMessage());
            return Health.down()
                    .withDetail("backend", backendName)
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
