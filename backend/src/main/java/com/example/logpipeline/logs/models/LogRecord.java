package com.example.logpipeline.logs.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The unit that flows from the ingest boundary through Kafka into a storage backend.
 * {@code id} stays null until a backend assigns one on write.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogRecord(
        @JsonProperty("id") String id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("level") LogLevel level,
        @JsonProperty("service") String service,
        @JsonProperty("message") String message,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("project_id") String projectId) implements Serializable {

    public LogRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(service, "service is required");
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(projectId, "project_id is required");
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public LogRecord withId(String newId) {
        return new LogRecord(newId, timestamp, level, service, message, metadata, projectId);
    }

    public LogRecord withMetadata(Map<String, Object> newMetadata) {
        return new LogRecord(id, timestamp, level, service, message, newMetadata, projectId);
    }
}
