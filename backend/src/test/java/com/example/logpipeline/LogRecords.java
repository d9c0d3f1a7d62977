package com.example.logpipeline;

import com.example.logpipeline.logs.models.LogLevel;
import com.example.logpipeline.logs.models.LogRecord;

import java.time.Instant;
import java.util.Map;

public final class LogRecords {

    public static final Instant BASE_TIME = Instant.parse("2025-03-01T12:00:00Z");

    private LogRecords() {
    }

    public static LogRecord record(String service, LogLevel level, String projectId, Instant timestamp, String message) {
        return new LogRecord(null, timestamp, level, service, message,
                Map.of("logger_name", service + ".main"), projectId);
    }

    public static LogRecord record(String service, LogLevel level, String projectId) {
        return record(service, level, projectId, BASE_TIME, "message from " + service);
    }
}
