package com.example.logpipeline.logs.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Case-insensitive lookup, so "error" and "ERROR" resolve to the same level.
     *
     * @throws IllegalArgumentException if the value is not one of the five levels
     */
    @JsonCreator
    public static LogLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Log level is required");
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid log level: " + value + ". Valid options: " + Arrays.toString(values()));
        }
    }

    @JsonValue
    public String value() {
        return name();
    }
}
