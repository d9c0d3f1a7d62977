package com.example.logpipeline.logs.DTOs;

import com.example.logpipeline.logs.models.LogLevel;
import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.LogTimestamps;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

public record LogIngestRequest(
        @NotBlank(message = "Message is required")
        String message,

        @Pattern(regexp = "(?i)DEBUG|INFO|WARNING|ERROR|CRITICAL",
                message = "Level must be one of DEBUG, INFO, WARNING, ERROR, CRITICAL")
        String level,

        @Size(max = 100, message = "Service must be at most 100 characters")
        String service,

        String timestamp,

        Map<String, Object> metadata) {

    public static final String DEFAULT_SERVICE = "default-service";

    public LogIngestRequest {
        level = (level == null || level.isBlank()) ? LogLevel.INFO.name() : level;
        service = (service == null || service.isBlank()) ? DEFAULT_SERVICE : service;
    }

    /**
     * @throws IllegalArgumentException for a malformed timestamp or level
     */
    public LogRecord toRecord(String projectId, Instant now) {
        Instant eventTime = (timestamp == null || timestamp.isBlank()) ? now : LogTimestamps.parse(timestamp);
        return new LogRecord(null, eventTime, LogLevel.fromString(level), service, message, metadata, projectId);
    }
}
