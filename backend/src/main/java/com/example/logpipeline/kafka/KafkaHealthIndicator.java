package com.example.logpipeline.kafka;

import com.example.logpipeline.config.LogPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * UP when the cluster answers. The ingest and dead letter topics are reported as details;
 * a missing topic only logs a warning because the broker may auto-create it on first publish.
 */
@Slf4j
@Component
public class KafkaHealthIndicator implements HealthIndicator {

    private static final int ADMIN_TIMEOUT_MS = 500;
    private static final long FUTURE_TIMEOUT_SECONDS = 5;

    private final KafkaAdmin kafkaAdmin;
    private final String topic;
    private final String deadLetterTopic;

    public KafkaHealthIndicator(KafkaAdmin kafkaAdmin, LogPipelineProperties properties) {
        this.kafkaAdmin = kafkaAdmin;
        this.topic = properties.kafka().topic();
        this.deadLetterTopic = properties.kafka().deadLetterTopic();
    }

    @Override
    public Health health() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            DescribeClusterResult cluster = adminClient.describeCluster(
                    new DescribeClusterOptions().timeoutMs(ADMIN_TIMEOUT_MS));
            String clusterId = cluster.clusterId().get(FUTURE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            int nodeCount = cluster.nodes().get(FUTURE_TIMEOUT_SECONDS, TimeUnit.SECONDS).size();

            Set<String> topics = adminClient.listTopics(new ListTopicsOptions().timeoutMs(ADMIN_TIMEOUT_MS))
                    .names()
                    .get(FUTURE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            boolean topicPresent = topics.contains(topic);
            if (!topicPresent) {
                log.warn("Kafka topic {} does not exist yet", topic);
            }

            log.debug("Kafka health check successful: clusterId={}, nodes={}", clusterId, nodeCount);
            return Health.up()
                    .withDetail("clusterId", clusterId)
                    .withDetail("nodes", nodeCount)
                    .withDetail("topic", topic)
                    .withDetail("topicPresent", topicPresent)
                    .withDetail("deadLetterTopicPresent", topics.contains(deadLetterTopic))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down(e);
        } catch (Exception e) {
            log.error("Kafka health check failed: {}", e.getMessage());
            return down(e);
        }
    }

    private Health down(Exception e) {
        return Health.down()
                .withDetail("error", e.getClass().getSimpleName())
                .withDetail("message", String.valueOf(e.getMessage()))
                .withDetail("topic", topic)
                .withDetail("status", "Kafka cluster is unreachable")
                .build();
    }
}
