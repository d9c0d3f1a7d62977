package com.example.logpipeline.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * One page of matching records, newest first.
 * {@code totalExact} is false when the search backend reported a lower bound instead of an exact count.
 */
public record QueryResult(
        @JsonProperty("logs") List<LogRecord> logs,
        @JsonProperty("total") long total,
        @JsonProperty("page") int page,
        @JsonProperty("size") int size,
        @JsonProperty("total_pages") int totalPages,
        @JsonIgnore boolean totalExact) implements Serializable {

    public QueryResult {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static QueryResult of(List<LogRecord> logs, long total, QueryFilter filter) {
        return of(logs, total, filter, true);
    }

    public static QueryResult of(List<LogRecord> logs, long total, QueryFilter filter, boolean totalExact) {
        return new QueryResult(logs, total, filter.page(), filter.size(), totalPages(total, filter.size()), totalExact);
    }

    public static QueryResult empty(QueryFilter filter) {
        return of(List.of(), 0, filter);
    }

    static int totalPages(long total, int size) {
        return (int) ((total + size - 1) / size);
    }
}
