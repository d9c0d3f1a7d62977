package com.example.logpipeline.elasticsearch;

import co.elastic.clients.elasticsearch._types.aggregations.Aggregation;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.QueryBuilders;
import com.example.logpipeline.logs.models.QueryFilter;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.elasticsearch.client.elc.NativeQuery;
import org.springframework.data.elasticsearch.client.elc.NativeQueryBuilder;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Translates a {@link QueryFilter} into the search DSL: fuzzy multi-field match in
 * {@code must}, unscored term and range filters in {@code filter}.
 */
@Component
public class LogQueryBuilder {

    public static final String SERVICES_AGG_NAME = "unique_services";
    public static final int MAX_SERVICE_BUCKETS = 1000;
    // index.max_result_window default; from + size past it is refused by the engine
    public static final int MAX_RESULT_WINDOW = 10_000;

    static final List<String> SEARCH_FIELDS = List.of(
            "message",
            "service",
            "metadata.logger_name",
            "metadata.pathname",
            "metadata.func_name",
            "metadata.file_name",
            "metadata.module"
    );

    static final String LEVEL_KEYWORD = "level.keyword";
    static final String SERVICE_KEYWORD = "service.keyword";
    static final String PROJECT_KEYWORD = "project_id.keyword";
    static final String TIMESTAMP_FIELD = "@timestamp";

    // property names, mapped to "@timestamp" and "id" by the converter
    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "normalizedTimestamp")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    /**
     * @throws IllegalArgumentException when the page ends past {@link #MAX_RESULT_WINDOW}
     */
    public NativeQuery buildSearchQuery(QueryFilter filter, boolean trackTotalHits) {
        if (filter.offset() + filter.size() > MAX_RESULT_WINDOW) {
            throw new IllegalArgumentException("Search results are limited to the first " + MAX_RESULT_WINDOW
                    + " matches; narrow the filter or request an earlier page");
        }
        NativeQueryBuilder builder = NativeQuery.builder()
                .withQuery(buildBoolQuery(filter))
                .withPageable(PageRequest.of(filter.page() - 1, filter.size()))
                .withSort(NEWEST_FIRST);

        if (trackTotalHits) {
            builder.withTrackTotalHits(true);
        }
        return builder.build();
    }

    public NativeQuery buildUniqueServicesQuery() {
        return NativeQuery.builder()
                .withQuery(QueryBuilders.matchAll().build()._toQuery())
                .withAggregation(SERVICES_AGG_NAME, Aggregation.of(a -> a
                        .terms(t -> t
                                .field(SERVICE_KEYWORD)
                                .size(MAX_SERVICE_BUCKETS))))
                .withMaxResults(0)
                .build();
    }

    Query buildBoolQuery(QueryFilter filter) {
        BoolQuery.Builder boolBuilder = new BoolQuery.Builder();

        if (filter.search() != null) {
            boolBuilder.must(QueryBuilders.multiMatch(m -> m
                    .query(filter.search())
                    .fields(SEARCH_FIELDS)
                    .fuzziness("AUTO")
                    .lenient(true)));
        } else {
            boolBuilder.must(QueryBuilders.matchAll().build()._toQuery());
        }

        if (filter.level() != null) {
            boolBuilder.filter(QueryBuilders.term(t -> t
                    .field(LEVEL_KEYWORD)
                    .value(filter.level().name())));
        }

        if (filter.service() != null) {
            boolBuilder.filter(QueryBuilders.term(t -> t
                    .field(SERVICE_KEYWORD)
                    .value(filter.service())));
        }

        if (filter.projectId() != null) {
            boolBuilder.filter(QueryBuilders.term(t -> t
                    .field(PROJECT_KEYWORD)
                    .value(filter.projectId())));
        }

        if (filter.hasTimeRange()) {
            boolBuilder.filter(QueryBuilders.range(r -> r
                    .date(d -> {
                        d.field(TIMESTAMP_FIELD);
                        if (filter.fromTs() != null) {
                            d.gte(String.valueOf(filter.fromTs().toEpochMilli()));
                        }
                        if (filter.toTs() != null) {
                            d.lte(String.valueOf(filter.toTs().toEpochMilli()));
                        }
                        return d;
                    })
            ));
        }

        return boolBuilder.build()._toQuery();
    }
}
