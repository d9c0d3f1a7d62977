package com.example.logpipeline.storage;

import com.example.logpipeline.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StorageBackendSelectorTest {

    private final AtomicInteger created = new AtomicInteger();
    private final List<LogStorageBackend> instances = new ArrayList<>();
    private StorageBackendSelector selector;

    @BeforeEach
    void setUp() {
        selector = new StorageBackendSelector(this::create, TestProperties.withBackend("search"));
    }

    private synchronized LogStorageBackend create(StorageBackendType type) {
        created.incrementAndGet();
        LogStorageBackend backend = mock(LogStorageBackend.class);
        when(backend.type()).thenReturn(type);
        instances.add(backend);
        return backend;
    }

    @Test
    void shouldResolveDefaultFromConfiguredAlias() {
        assertThat(selector.defaultType()).isEqualTo(StorageBackendType.ELASTICSEARCH);
        assertThat(selector.resolve(null).type()).isEqualTo(StorageBackendType.ELASTICSEARCH);
        assertThat(selector.resolve("").type()).isEqualTo(StorageBackendType.ELASTICSEARCH);
    }

    @Test
    void shouldReuseInstancePerType() {
        LogStorageBackend first = selector.resolve("postgres");
        LogStorageBackend second = selector.resolve("relational");

        assertThat(first).isSameAs(second);
        assertThat(created).hasValue(1);
        assertThat(selector.cachedCount()).isEqualTo(1);
    }

    @Test
    void shouldNeverCacheMoreThanOneInstancePerType() {
        for (int i = 0; i < 50; i++) {
            selector.resolve("postgres");
            selector.resolve("search");
            selector.resolve("object-store");
        }

        assertThat(selector.cachedCount()).isEqualTo(StorageBackendType.values().length);
        assertThat(created).hasValue(3);
    }

    @Test
    void shouldConstructOnceUnderConcurrentFirstUse() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LogStorageBackend>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return selector.resolve("s3");
                }));
            }
            start.countDown();

            LogStorageBackend expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<LogStorageBackend> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(created).hasValue(1);
    }

    @Test
    void shouldRejectUnknownBackendWithoutCreatingAnything() {
        assertThatThrownBy(() -> selector.resolve("cassandra"))
                .isInstanceOf(UnknownStorageBackendException.class)
                .hasMessageContaining("Valid options");

        assertThat(created).hasValue(0);
    }

    @Test
    void shouldFailFastOnUnknownDefault() {
        assertThatThrownBy(() -> new StorageBackendSelector(this::create, TestProperties.withBackend("nope")))
                .isInstanceOf(UnknownStorageBackendException.class);
    }

    @Test
    void shouldCloseEveryBackendOnShutdownEvenIfOneFails() {
        LogStorageBackend postgres = selector.resolve("postgres");
        LogStorageBackend s3 = selector.resolve("s3");
        doThrow(new IllegalStateException("already gone")).when(postgres).close();

        selector.destroy();

        verify(postgres).close();
        verify(s3).close();
        assertThat(selector.cachedCount()).isZero();
    }
}
