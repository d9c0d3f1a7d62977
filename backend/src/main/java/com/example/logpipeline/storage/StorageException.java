package com.example.logpipeline.storage;

/**
 * A storage backend failed to answer a read. Distinct from an empty result.
 */
public class StorageException extends RuntimeException {

    private final StorageBackendType backend;

    public StorageException(StorageBackendType backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public StorageBackendType getBackend() {
        return backend;
    }
}
