package com.example.logpipeline.storage;

import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;
import com.example.logpipeline.logs.models.QueryResult;

import java.util.List;

/**
 * Capability contract shared by every storage engine. Query semantics
 * (filters, ordering, pagination) are identical across implementations.
 * <p>
 * Read-after-write visibility is not. The relational and object-store backends return a
 * saved record from the next query. The search backend only does so with
 * {@code logpipeline.elasticsearch.refresh-on-write} enabled; by default a record becomes
 * visible after the next index refresh, about one second later. The search backend also
 * refuses pages that end past its 10,000-hit result window with {@link IllegalArgumentException}.
 */
public interface LogStorageBackend extends AutoCloseable {

    StorageBackendType type();

    /**
     * Persists one record, assigning its id. Never throws; a failure is logged and reported as {@code false}.
     */
    boolean save(LogRecord record);

    /**
     * Returns the requested page of matching records, newest timestamp first.
     * An empty result means nothing matched, or the page starts past the last match;
     * {@code total} is reported either way.
     *
     * @throws StorageException if the backend could not answer the query
     * @throws IllegalArgumentException if the backend cannot serve a page that deep
     */
    QueryResult queryLogs(QueryFilter filter);

    /**
     * Distinct service names, case preserved, sorted alphabetically.
     *
     * @throws StorageException if the backend could not answer the query
     */
    List<String> getUniqueServices();

    boolean healthCheck();

    /**
     * Releases backend-held resources. Safe to call more than once.
     */
    @Override
    void close();
}
