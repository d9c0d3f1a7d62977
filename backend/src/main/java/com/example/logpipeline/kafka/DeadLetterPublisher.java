package com.example.logpipeline.kafka;

import com.example.logpipeline.config.LogPipelineProperties;
import com.example.logpipeline.logs.models.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Parks records the storage backend rejected on the dead letter topic, tagged with where they
 * came from, for manual replay. Nothing consumes that topic automatically.
 */
@Slf4j
@Service
public class DeadLetterPublisher {

    private final KafkaTemplate<String, LogRecord> kafkaTemplate;
    private final PipelineMetrics pipelineMetrics;
    private final String deadLetterTopic;

    public DeadLetterPublisher(KafkaTemplate<String, LogRecord> kafkaTemplate,
                               PipelineMetrics pipelineMetrics,
                               LogPipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.pipelineMetrics = pipelineMetrics;
        this.deadLetterTopic = properties.kafka().deadLetterTopic();
    }

    public void send(LogRecord record, String error, int partition, long offset) {
        log.error("Sending to DLQ: service={}, projectId={}, partition={}, offset={}, error={}",
                record.service(), record.projectId(), partition, offset, error);

        Map<String, Object> metadata = new HashMap<>(record.metadata());
        metadata.put("dlq-timestamp", Instant.now().toString());
        metadata.put("dlq-error", error);
        metadata.put("dlq-original-partition", partition);
        metadata.put("dlq-original-offset", offset);

        try {
            kafkaTemplate.send(deadLetterTopic, record.service(), record.withMetadata(metadata))
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("CRITICAL: Failed to send to DLQ! Replay from partition={} offset={}. " +
                                    "service={}, error={}", partition, offset, record.service(), ex.getMessage());
                        } else {
                            pipelineMetrics.recordDeadLettered();
                        }
                    });
        } catch (Exception e) {
            log.error("CRITICAL: DLQ send threw exception! Replay from partition={} offset={}. service={}, error={}",
                    partition, offset, record.service(), e.getMessage());
        }
    }
}
