package com.example.logpipeline.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StorageHealthIndicatorTest {

    @Mock
    private StorageBackendSelector selector;

    @Mock
    private LogStorageBackend backend;

    @Test
    void shouldReportUpWhenDefaultBackendIsHealthy() {
        when(selector.defaultType()).thenReturn(StorageBackendType.POSTGRES);
        when(selector.getDefault()).thenReturn(backend);
        when(backend.healthCheck()).thenReturn(true);

        Health health = new StorageHealthIndicator(selector).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("backend", "postgres");
    }

    @Test
    void shouldReportDownWhenProbeFails() {
        when(selector.defaultType()).thenReturn(StorageBackendType.S3);
        when(selector.getDefault()).thenReturn(backend);
        when(backend.healthCheck()).thenReturn(false);

        assertThat(new StorageHealthIndicator(selector).health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void shouldReportDownWhenBackendCannotBeCreated() {
        when(selector.defaultType()).thenReturn(StorageBackendType.ELASTICSEARCH);
        when(selector.getDefault()).thenThrow(new IllegalStateException("no client"));

        Health health = new StorageHealthIndicator(selector).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
                .containsEntry("error", "IllegalStateException")
                .containsEntry("message", "no client");
    }
}
