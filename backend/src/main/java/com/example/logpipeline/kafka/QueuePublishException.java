package com.example.logpipeline.kafka;

/**
 * The queue did not acknowledge a record in time. Surfaces to HTTP clients as 503.
 */
public class QueuePublishException extends RuntimeException {

    public QueuePublishException(String message) {
        super(message);
    }
}
