package com.example.logpipeline.logs.models;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 parsing shared by the ingest boundary and every backend.
 * A trailing 'Z' is the UTC offset; a timestamp without any offset is read as UTC.
 */
public final class LogTimestamps {

    private LogTimestamps() {
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timestamp is required");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp format. Use ISO 8601 format: " + value, e);
        }
    }

    public static Instant parseOrNull(String value) {
        return (value == null || value.isBlank()) ? null : parse(value);
    }
}
