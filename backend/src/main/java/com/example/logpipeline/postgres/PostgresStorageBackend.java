package com.example.logpipeline.postgres;

import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;
import com.example.logpipeline.logs.models.QueryResult;
import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendType;
import com.example.logpipeline.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relational backend. Every call runs in its own repository transaction, so no
 * persistence context outlives a single operation and a failed insert rolls back.
 * <p>
 * Hibernate boots without touching the database, so the table is created here, when the
 * backend is first selected, rather than by schema generation at startup.
 */
@Slf4j
public class PostgresStorageBackend implements LogStorageBackend {

    static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS log_entries (
                id VARCHAR(36) PRIMARY KEY,
                timestamp TIMESTAMP(6) WITH TIME ZONE NOT NULL,
                level VARCHAR(16) NOT NULL,
                service VARCHAR(255) NOT NULL,
                message TEXT NOT NULL,
                metadata JSONB,
                project_id VARCHAR(255) NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_log_entries_timestamp ON log_entries (timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_log_entries_level ON log_entries (level)",
            "CREATE INDEX IF NOT EXISTS idx_log_entries_service ON log_entries (service)",
            "CREATE INDEX IF NOT EXISTS idx_log_entries_project_id ON log_entries (project_id)"
    );

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "timestamp")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final LogEntryRepository logEntryRepository;
    private final LogEntrySpecification logEntrySpecification;
    private final JdbcTemplate jdbcTemplate;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PostgresStorageBackend(LogEntryRepository logEntryRepository,
                                  LogEntrySpecification logEntrySpecification,
                                  JdbcTemplate jdbcTemplate) {
        this.logEntryRepository = logEntryRepository;
        this.logEntrySpecification = logEntrySpecification;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the log table and its indexes when they do not exist yet.
     */
    public void ensureSchema() {
        SCHEMA.forEach(jdbcTemplate::execute);
        log.info("Ensured postgres schema for log_entries");
    }

    @Override
    public StorageBackendType type() {
        return StorageBackendType.POSTGRES;
    }

    @Override
    public boolean save(LogRecord record) {
        try {
            LogEntry saved = logEntryRepository.save(toEntity(record));
            log.debug("Saved log entry id={} service={}", saved.getId(), record.service());
            return true;
        } catch (Exception e) {
            log.error("Failed to save log to postgres: service={}, projectId={}, error={}",
                    record.service(), record.projectId(), e.getMessage());
            return false;
        }
    }

    @Override
    public QueryResult queryLogs(QueryFilter filter) {
        Specification<LogEntry> spec = logEntrySpecification.buildSpecification(filter);
        Pageable pageable = PageRequest.of(filter.page() - 1, filter.size(), NEWEST_FIRST);
        try {
            Page<LogEntry> results = logEntryRepository.findAll(spec, pageable);
            List<LogRecord> logs = results.getContent().stream()
                    .map(PostgresStorageBackend::toRecord)
                    .toList();
            return QueryResult.of(logs, results.getTotalElements(), filter);
        } catch (Exception e) {
            log.error("Postgres query failed: filter={}, error={}", filter, e.getMessage());
            throw new StorageException(type(), "Failed to query logs from postgres", e);
        }
    }

    @Override
    public List<String> getUniqueServices() {
        try {
            return logEntryRepository.findDistinctServices().stream()
                    .filter(Objects::nonNull)
                    .sorted()
                    .toList();
        } catch (Exception e) {
            log.error("Postgres service listing failed: {}", e.getMessage());
            throw new StorageException(type(), "Failed to list services from postgres", e);
        }
    }

    @Override
    public boolean healthCheck() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.warn("Postgres health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        // connection pool and entity manager factory belong to the application context
        if (closed.compareAndSet(false, true)) {
            log.info("Postgres storage backend closed");
        }
    }

    static LogEntry toEntity(LogRecord record) {
        LogEntry entry = new LogEntry();
        entry.setTimestamp(record.timestamp());
        entry.setLevel(record.level());
        entry.setService(record.service());
        entry.setMessage(record.message());
        entry.setMetadata(new HashMap<>(record.metadata()));
        entry.setProjectId(record.projectId());
        return entry;
    }

    static LogRecord toRecord(LogEntry entry) {
        return new LogRecord(
                entry.getId(),
                entry.getTimestamp(),
                entry.getLevel(),
                entry.getService(),
                entry.getMessage(),
                entry.getMetadata(),
                entry.getProjectId()
        );
    }
}
