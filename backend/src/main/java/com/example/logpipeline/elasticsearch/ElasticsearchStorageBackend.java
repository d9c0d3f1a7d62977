package com.example.logpipeline.elasticsearch;

import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import co.elastic.clients.elasticsearch._types.aggregations.StringTermsBucket;
import com.example.logpipeline.logs.models.LogLevel;
import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;
import com.example.logpipeline.logs.models.QueryResult;
import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendType;
import com.example.logpipeline.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregation;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchAggregations;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.data.elasticsearch.core.IndexOperations;
import org.springframework.data.elasticsearch.core.SearchHit;
import org.springframework.data.elasticsearch.core.SearchHits;
import org.springframework.data.elasticsearch.core.TotalHitsRelation;
import org.springframework.data.elasticsearch.core.mapping.IndexCoordinates;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Search backend over a single index.
 * <p>
 * Documents become searchable after the index refreshes (about one second by default),
 * unless {@code refreshOnWrite} forces a refresh after every save.
 * {@code total} is exact only when total-hit tracking is on; otherwise the engine stops
 * counting at 10,000 and the result is flagged with {@code totalExact = false}.
 */
@Slf4j
public class ElasticsearchStorageBackend implements LogStorageBackend {

    private final ElasticsearchOperations elasticsearchOperations;
    private final LogQueryBuilder logQueryBuilder;
    private final IndexCoordinates index;
    private final boolean trackTotalHits;
    private final boolean refreshOnWrite;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ElasticsearchStorageBackend(ElasticsearchOperations elasticsearchOperations,
                                       LogQueryBuilder logQueryBuilder,
                                       String indexName,
                                       boolean trackTotalHits,
                                       boolean refreshOnWrite) {
        this.elasticsearchOperations = elasticsearchOperations;
        this.logQueryBuilder = logQueryBuilder;
        this.index = IndexCoordinates.of(indexName);
        this.trackTotalHits = trackTotalHits;
        this.refreshOnWrite = refreshOnWrite;
    }

    /**
     * Creates the index with the {@link LogDocument} mapping when it does not exist yet.
     */
    public void ensureIndex() {
        IndexOperations indexOps = elasticsearchOperations.indexOps(index);
        if (!indexOps.exists()) {
            indexOps.create();
            indexOps.putMapping(indexOps.createMapping(LogDocument.class));
            log.info("Created Elasticsearch index {}", index.getIndexName());
        }
    }

    @Override
    public StorageBackendType type() {
        return StorageBackendType.ELASTICSEARCH;
    }

    @Override
    public boolean save(LogRecord record) {
        try {
            LogDocument document = toDocument(record.withId(UUID.randomUUID().toString()));
            elasticsearchOperations.save(document, index);
            if (refreshOnWrite) {
                elasticsearchOperations.indexOps(index).refresh();
            }
            log.debug("Indexed log document id={} service={}", document.getId(), record.service());
            return true;
        } catch (Exception e) {
            log.error("Failed to index log in Elasticsearch: service={}, projectId={}, error={}",
                    record.service(), record.projectId(), e.getMessage());
            return false;
        }
    }

    @Override
    public QueryResult queryLogs(QueryFilter filter) {
        NativeQuery query = logQueryBuilder.buildSearchQuery(filter, trackTotalHits);
        try {
            SearchHits<LogDocument> searchHits = elasticsearchOperations.search(query, LogDocument.class, index);

            List<LogRecord> logs = searchHits.getSearchHits().stream()
                    .map(SearchHit::getContent)
                    .map(ElasticsearchStorageBackend::toRecord)
                    .toList();

            boolean exact = searchHits.getTotalHitsRelation() != TotalHitsRelation.GREATER_THAN_OR_EQUAL_TO;
            if (!exact) {
                log.debug("Elasticsearch reported a lower-bound total of {} hits", searchHits.getTotalHits());
            }
            return QueryResult.of(logs, searchHits.getTotalHits(), filter, exact);
        } catch (Exception e) {
            log.error("Elasticsearch query failed: filter={}, error={}", filter, e.getMessage());
            throw new StorageException(type(), "Failed to query logs from Elasticsearch", e);
        }
    }

    @Override
    public List<String> getUniqueServices() {
        try {
            SearchHits<LogDocument> searchHits = elasticsearchOperations.search(
                    logQueryBuilder.buildUniqueServicesQuery(), LogDocument.class, index);
            return extractServiceBuckets(searchHits).stream().sorted().toList();
        } catch (Exception e) {
            log.error("Elasticsearch service aggregation failed: {}", e.getMessage());
            throw new StorageException(type(), "Failed to list services from Elasticsearch", e);
        }
    }

    @Override
    public boolean healthCheck() {
        try {
            String status = elasticsearchOperations.cluster().health().getStatus();
            return "green".equalsIgnoreCase(status) || "yellow".equalsIgnoreCase(status);
        } catch (Exception e) {
            log.warn("Elasticsearch health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        // the client is shared with the application context, which closes it
        if (closed.compareAndSet(false, true)) {
            log.info("Elasticsearch storage backend closed");
        }
    }

    private List<String> extractServiceBuckets(SearchHits<LogDocument> searchHits) {
        List<String> services = new ArrayList<>();
        if (!searchHits.hasAggregations()) {
            return services;
        }

        ElasticsearchAggregations aggregations = (ElasticsearchAggregations) searchHits.getAggregations();
        for (ElasticsearchAggregation elasticsearchAggregation : aggregations.aggregations()) {
            if (!LogQueryBuilder.SERVICES_AGG_NAME.equals(elasticsearchAggregation.aggregation().getName())) {
                continue;
            }
            Aggregate aggregate = elasticsearchAggregation.aggregation().getAggregate();
            if (!aggregate.isSterms()) {
                log.warn("Service aggregation is not string terms, got: {}", aggregate._kind());
                continue;
            }
            for (StringTermsBucket bucket : aggregate.sterms().buckets().array()) {
                services.add(bucket.key().stringValue());
            }
        }
        return services;
    }

    static LogDocument toDocument(LogRecord record) {
        LogDocument document = new LogDocument();
        document.setId(record.id());
        document.setTimestamp(record.timestamp());
        document.setNormalizedTimestamp(record.timestamp());
        document.setLevel(record.level().name());
        document.setService(record.service());
        document.setMessage(record.message());
        document.setMetadata(new HashMap<>(record.metadata()));
        document.setProjectId(record.projectId());
        return document;
    }

    static LogRecord toRecord(LogDocument document) {
        return new LogRecord(
                document.getId(),
                document.getTimestamp(),
                LogLevel.fromString(document.getLevel()),
                document.getService(),
                document.getMessage(),
                document.getMetadata(),
                document.getProjectId()
        );
    }
}
