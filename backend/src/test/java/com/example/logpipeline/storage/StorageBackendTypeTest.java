package com.example.logpipeline.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageBackendTypeTest {

    @ParameterizedTest
    @CsvSource({
            "postgres, POSTGRES",
            "relational, POSTGRES",
            "sqlite, POSTGRES",
            "Elasticsearch, ELASTICSEARCH",
            "search, ELASTICSEARCH",
            "S3, S3",
            "object-store, S3"
    })
    void shouldResolveCanonicalNamesAndAliases(String name, StorageBackendType expected) {
        assertThat(StorageBackendType.fromName(name)).isEqualTo(expected);
    }

    @Test
    void shouldNameValidOptionsForUnknownBackend() {
        assertThatThrownBy(() -> StorageBackendType.fromName("mongo"))
                .isInstanceOf(UnknownStorageBackendException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mongo")
                .hasMessageContaining("Valid options: [postgres, elasticsearch, s3]");
    }

    @Test
    void shouldRejectMissingName() {
        assertThatThrownBy(() -> StorageBackendType.fromName(" "))
                .isInstanceOf(UnknownStorageBackendException.class);
    }
}
