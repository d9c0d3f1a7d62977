package com.example.logpipeline.elasticsearch;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.*;

import java.time.Instant;
import java.util.Map;

/**
 * Index document for one log record. level, service and project_id carry a
 * {@code .keyword} sub-field for exact filters and aggregations.
 */
@Data
@Document(indexName = "logs", createIndex = false)
public class LogDocument {
    @Id
    @Field(type = FieldType.Keyword)
    private String id;

    @Field(type = FieldType.Date, format = DateFormat.epoch_millis)
    private Instant timestamp;

    @Field(name = "@timestamp", type = FieldType.Date, format = DateFormat.epoch_millis)
    private Instant normalizedTimestamp;

    @MultiField(
            mainField = @Field(type = FieldType.Text),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword))
    private String level;

    @MultiField(
            mainField = @Field(type = FieldType.Text),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword, ignoreAbove = 256))
    private String service;

    @Field(type = FieldType.Text, analyzer = "standard")
    private String message;

    @Field(type = FieldType.Object)
    private Map<String, Object> metadata;

    @MultiField(
            mainField = @Field(name = "project_id", type = FieldType.Text),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword))
    private String projectId;
}
