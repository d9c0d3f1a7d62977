package com.example.logpipeline.storage;

public class UnknownStorageBackendException extends IllegalArgumentException {

    public UnknownStorageBackendException(String message) {
        super(message);
    }
}
