package com.example.logpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

/**
 * Application settings under the 'logpipeline' prefix.
 */
@ConfigurationProperties(prefix = "logpipeline")
@Validated
public record LogPipelineProperties(

        @Valid
        @NotNull
        @DefaultValue
        StorageProperties storage,

        @Valid
        @NotNull
        @DefaultValue
        KafkaProperties kafka,

        @Valid
        @NotNull
        @DefaultValue
        ElasticsearchProperties elasticsearch,

        @Valid
        @NotNull
        @DefaultValue
        S3Properties s3,

        @Valid
        @NotNull
        @DefaultValue
        AuthProperties auth
) {

    // --- StorageProperties ---
    public record StorageProperties(
            @NotBlank(message = "Default storage backend (logpipeline.storage.backend) must be provided.")
            @DefaultValue("elasticsearch")
            String backend
    ) {}

    // --- KafkaProperties ---
    public record KafkaProperties(
            @NotBlank @DefaultValue("logs") String topic,
            @NotBlank @DefaultValue("logs-dlq") String deadLetterTopic,
            @NotBlank @DefaultValue("log-consumer-group") String groupId,
            @NotNull @DefaultValue("10s") Duration publishTimeout
    ) {
        /**
         * The producer's delivery timeout is the publish timeout and must cover linger plus
         * request timeout (half the publish timeout), or the client refuses to start.
         */
        public static final Duration MIN_PUBLISH_TIMEOUT = Duration.ofMillis(100);

        @AssertTrue(message = "Publish timeout (logpipeline.kafka.publish-timeout) must be at least 100ms.")
        public boolean isPublishTimeoutValid() {
            return publishTimeout == null || publishTimeout.compareTo(MIN_PUBLISH_TIMEOUT) >= 0;
        }
    }

    // --- ElasticsearchProperties ---
    public record ElasticsearchProperties(
            @NotBlank @DefaultValue("logs") String index,
            @DefaultValue("false") boolean trackTotalHits,
            @DefaultValue("false") boolean refreshOnWrite
    ) {}

    // --- S3Properties ---
    public record S3Properties(
            @DefaultValue("http://localhost:9000") String endpoint,
            @DefaultValue("minioadmin") String accessKey,
            @DefaultValue("minioadmin") String secretKey,
            @NotBlank @DefaultValue("log-storage") String bucket,
            @NotBlank @DefaultValue("us-east-1") String region,
            @DefaultValue("logs") String prefix
    ) {}

    /**
     * Project id to hex SHA-256 of that project's API key.
     */
    public record AuthProperties(
            Map<String, String> projects
    ) {
        public AuthProperties {
            projects = projects == null ? Map.of() : Map.copyOf(projects);
        }
    }
}
