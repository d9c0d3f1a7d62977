package com.example.logpipeline.storage;

/**
 * Builds a fresh backend instance. Called at most once per type by {@link StorageBackendSelector}.
 */
@FunctionalInterface
public interface StorageBackendFactory {

    LogStorageBackend create(StorageBackendType type);
}
