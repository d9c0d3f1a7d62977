package com.example.logpipeline.logs.models;

import java.time.Instant;

/**
 * Immutable query predicates plus pagination. Every predicate is optional;
 * "ALL" for level or service is normalized to "no filter" at construction time,
 * so backends only ever see real values or null.
 */
public record QueryFilter(
        String search,
        LogLevel level,
        String service,
        String projectId,
        Instant fromTs,
        Instant toTs,
        int page,
        int size) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_SIZE = 50;
    public static final int MAX_SIZE = 1000;

    private static final String ALL = "ALL";

    public QueryFilter {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (size < 1 || size > MAX_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_SIZE);
        }
        if (fromTs != null && toTs != null && fromTs.isAfter(toTs)) {
            throw new IllegalArgumentException("Start time cannot be after end time");
        }
        search = blankToNull(search);
        service = ALL.equalsIgnoreCase(blankToNull(service)) ? null : blankToNull(service);
        projectId = blankToNull(projectId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QueryFilter all() {
        return builder().build();
    }

    /**
     * Index of the first record on this page. Computed as a long: page and size are both
     * int, and their product passes {@link Integer#MAX_VALUE} long before they are invalid.
     */
    public long offset() {
        return (long) (page - 1) * size;
    }

    public boolean hasTimeRange() {
        return fromTs != null || toTs != null;
    }

    public boolean matchesTime(Instant timestamp) {
        if (fromTs != null && timestamp.isBefore(fromTs)) {
            return false;
        }
        return toTs == null || !timestamp.isAfter(toTs);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    public static final class Builder {
        private String search;
        private LogLevel level;
        private String service;
        private String projectId;
        private Instant fromTs;
        private Instant toTs;
        private int page = DEFAULT_PAGE;
        private int size = DEFAULT_SIZE;

        private Builder() {
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        /**
         * Accepts a raw level name; null, blank and "ALL" mean no level filter.
         */
        public Builder level(String level) {
            this.level = (level == null || level.isBlank() || ALL.equalsIgnoreCase(level.trim()))
                    ? null
                    : LogLevel.fromString(level);
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder fromTs(Instant fromTs) {
            this.fromTs = fromTs;
            return this;
        }

        public Builder toTs(Instant toTs) {
            this.toTs = toTs;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public QueryFilter build() {
            return new QueryFilter(search, level, service, projectId, fromTs, toTs, page, size);
        }
    }
}
