package com.example.logpipeline.storage;

import com.example.logpipeline.config.LogPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a backend name (per-query override, else the configured default) to a live,
 * cached backend. The cache is keyed by {@link StorageBackendType}, so it never holds more
 * entries than there are backend types and nothing is ever evicted while in use.
 * Concurrent first requests for the same type construct it once.
 */
@Slf4j
@Component
public class StorageBackendSelector implements DisposableBean {

    private final StorageBackendFactory factory;
    private final StorageBackendType defaultType;
    private final Map<StorageBackendType, LogStorageBackend> backends =
            new ConcurrentHashMap<>(StorageBackendType.values().length);

    public StorageBackendSelector(StorageBackendFactory factory, LogPipelineProperties properties) {
        this.factory = factory;
        this.defaultType = StorageBackendType.fromName(properties.storage().backend());
        log.info("Default storage backend: {}", defaultType.backendName());
    }

    public StorageBackendType defaultType() {
        return defaultType;
    }

    public LogStorageBackend getDefault() {
        return get(defaultType);
    }

    /**
     * @param backendName requested backend, or null/blank for the configured default
     */
    public LogStorageBackend resolve(String backendName) {
        if (backendName == null || backendName.isBlank()) {
            return getDefault();
        }
        return get(StorageBackendType.fromName(backendName));
    }

    public LogStorageBackend get(StorageBackendType type) {
        return backends.computeIfAbsent(type, t -> {
            log.info("Creating {} storage backend", t.backendName());
            return factory.create(t);
        });
    }

    int cachedCount() {
        return backends.size();
    }

    @Override
    public void destroy() {
        backends.forEach((type, backend) -> {
            try {
                backend.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close {} storage backend: {}", type.backendName(), e.getMessage());
            }
        });
        backends.clear();
    }
}
