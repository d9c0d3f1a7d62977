package com.example.logpipeline.logs.models;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogTimestampsTest {

    @Test
    void shouldParseTrailingZAsUtc() {
        assertThat(LogTimestamps.parse("2025-03-01T12:00:00Z"))
                .isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
    }

    @Test
    void shouldApplyExplicitOffset() {
        assertThat(LogTimestamps.parse("2025-03-01T14:00:00+02:00"))
                .isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
    }

    @Test
    void shouldReadTimestampWithoutOffsetAsUtc() {
        assertThat(LogTimestamps.parse("2025-03-01T12:00:00.123"))
                .isEqualTo(Instant.parse("2025-03-01T12:00:00.123Z"));
    }

    @Test
    void shouldRejectMalformedTimestamp() {
        assertThatThrownBy(() -> LogTimestamps.parse("yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ISO 8601");
    }

    @Test
    void shouldReturnNullForMissingOptionalTimestamp() {
        assertThat(LogTimestamps.parseOrNull(null)).isNull();
        assertThat(LogTimestamps.parseOrNull("")).isNull();
    }
}
