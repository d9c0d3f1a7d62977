package com.example.logpipeline.s3;

import com.example.logpipeline.logs.models.LogLevel;
import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.example.logpipeline.LogRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

class ObjectKeysTest {

    private final ObjectKeys keys = new ObjectKeys("logs");

    @Test
    void shouldLayOutKeyByProjectDateAndRecordFields() {
        LogRecord record = record("auth", LogLevel.ERROR, "p1",
                Instant.parse("2025-03-01T12:34:56.789Z"), "boom");

        String key = keys.keyFor(record);

        assertThat(key).startsWith("logs/p1/2025/03/01/12/20250301123456789_auth_ERROR_");
        assertThat(key).endsWith(".json");
        assertThat(key).matches("logs/p1/2025/03/01/12/20250301123456789_auth_ERROR_[0-9a-f]{12}\\.json");
    }

    @Test
    void shouldGiveIdenticalRecordsTheSameKeyAndDistinctRecordsDifferentKeys() {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        LogRecord first = record("auth", LogLevel.INFO, "p1", now, "one");
        LogRecord same = record("auth", LogLevel.INFO, "p1", now, "one");
        LogRecord other = record("auth", LogLevel.INFO, "p1", now, "two");

        assertThat(keys.keyFor(first)).isEqualTo(keys.keyFor(same));
        assertThat(keys.keyFor(first)).isNotEqualTo(keys.keyFor(other));
    }

    @Test
    void shouldReplaceUnsafeCharactersInSegments() {
        LogRecord record = record("billing/api v2", LogLevel.INFO, "team:a", Instant.parse("2025-03-01T00:00:00Z"), "x");

        assertThat(keys.keyFor(record)).startsWith("logs/team-a/2025/03/01/00/20250301000000000_billing-api-v2_INFO_");
    }

    @Test
    void shouldNormalizeRootPrefix() {
        assertThat(new ObjectKeys("/logs/").rootPrefix()).isEqualTo("logs/");
        assertThat(new ObjectKeys("archive/logs").rootPrefix()).isEqualTo("archive/logs/");
        assertThat(new ObjectKeys("").rootPrefix()).isEmpty();
        assertThat(new ObjectKeys(null).rootPrefix()).isEmpty();
    }

    @Test
    void shouldListFromRootWithoutProject() {
        QueryFilter filter = QueryFilter.builder()
                .fromTs(Instant.parse("2025-03-01T00:00:00Z"))
                .toTs(Instant.parse("2025-03-01T05:00:00Z"))
                .build();

        assertThat(keys.listingPrefix(filter)).isEqualTo("logs/");
    }

    @Test
    void shouldListUnderProjectWhenOnlyOneBoundIsGiven() {
        QueryFilter filter = QueryFilter.builder()
                .projectId("p1")
                .fromTs(Instant.parse("2025-03-01T00:00:00Z"))
                .build();

        assertThat(keys.listingPrefix(filter)).isEqualTo("logs/p1/");
    }

    @Test
    void shouldAppendSharedDateComponentsWhenBothBoundsAreGiven() {
        QueryFilter sameDay = QueryFilter.builder()
                .projectId("p1")
                .fromTs(Instant.parse("2025-03-01T01:00:00Z"))
                .toTs(Instant.parse("2025-03-01T05:00:00Z"))
                .build();
        QueryFilter sameHour = QueryFilter.builder()
                .projectId("p1")
                .fromTs(Instant.parse("2025-03-01T05:00:00Z"))
                .toTs(Instant.parse("2025-03-01T05:59:59Z"))
                .build();
        QueryFilter acrossYears = QueryFilter.builder()
                .projectId("p1")
                .fromTs(Instant.parse("2024-12-31T23:00:00Z"))
                .toTs(Instant.parse("2025-01-01T01:00:00Z"))
                .build();

        assertThat(keys.listingPrefix(sameDay)).isEqualTo("logs/p1/2025/03/01/");
        assertThat(keys.listingPrefix(sameHour)).isEqualTo("logs/p1/2025/03/01/05/");
        assertThat(keys.listingPrefix(acrossYears)).isEqualTo("logs/p1/");
    }
}
