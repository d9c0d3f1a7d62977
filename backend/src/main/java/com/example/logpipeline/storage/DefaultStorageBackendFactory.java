package com.example.logpipeline.storage;

import com.example.logpipeline.config.LogPipelineProperties;
import com.example.logpipeline.elasticsearch.ElasticsearchStorageBackend;
import com.example.logpipeline.elasticsearch.LogQueryBuilder;
import com.example.logpipeline.postgres.LogEntryRepository;
import com.example.logpipeline.postgres.LogEntrySpecification;
import com.example.logpipeline.postgres.PostgresStorageBackend;
import com.example.logpipeline.s3.S3ClientFactory;
import com.example.logpipeline.s3.S3StorageBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Builds backends from application context beans. Dependencies are looked up only when the
 * matching backend is first requested.
 */
@Component
public class DefaultStorageBackendFactory implements StorageBackendFactory {

    private final ObjectProvider<LogEntryRepository> logEntryRepository;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final ObjectProvider<ElasticsearchOperations> elasticsearchOperations;
    private final LogEntrySpecification logEntrySpecification;
    private final LogQueryBuilder logQueryBuilder;
    private final ObjectMapper objectMapper;
    private final LogPipelineProperties properties;

    public DefaultStorageBackendFactory(ObjectProvider<LogEntryRepository> logEntryRepository,
                                        ObjectProvider<JdbcTemplate> jdbcTemplate,
                                        ObjectProvider<ElasticsearchOperations> elasticsearchOperations,
                                        LogEntrySpecification logEntrySpecification,
                                        LogQueryBuilder logQueryBuilder,
                                        ObjectMapper objectMapper,
                                        LogPipelineProperties properties) {
        this.logEntryRepository = logEntryRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.elasticsearchOperations = elasticsearchOperations;
        this.logEntrySpecification = logEntrySpecification;
        this.logQueryBuilder = logQueryBuilder;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public LogStorageBackend create(StorageBackendType type) {
        return switch (type) {
            case POSTGRES -> createPostgres();
            case ELASTICSEARCH -> createElasticsearch();
            case S3 -> createS3();
        };
    }

    private LogStorageBackend createPostgres() {
        PostgresStorageBackend backend = new PostgresStorageBackend(
                logEntryRepository.getObject(),
                logEntrySpecification,
                jdbcTemplate.getObject());
        backend.ensureSchema();
        return backend;
    }

    private LogStorageBackend createElasticsearch() {
        LogPipelineProperties.ElasticsearchProperties es = properties.elasticsearch();
        ElasticsearchStorageBackend backend = new ElasticsearchStorageBackend(
                elasticsearchOperations.getObject(),
                logQueryBuilder,
                es.index(),
                es.trackTotalHits(),
                es.refreshOnWrite());
        backend.ensureIndex();
        return backend;
    }

    private LogStorageBackend createS3() {
        LogPipelineProperties.S3Properties s3 = properties.s3();
        S3Client client = S3ClientFactory.create(s3);
        S3StorageBackend backend = new S3StorageBackend(client, objectMapper, s3.bucket(), s3.prefix());
        try {
            backend.ensureBucket(s3.region());
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return backend;
    }
}
