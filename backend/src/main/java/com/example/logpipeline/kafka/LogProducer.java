package com.example.logpipeline.kafka;

import com.example.logpipeline.config.LogPipelineProperties;
import com.example.logpipeline.logs.models.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes records keyed by service, so one service's records stay ordered within a partition.
 * Each publish waits for the acknowledgment, bounded by {@code logpipeline.kafka.publish-timeout}.
 */
@Slf4j
@Service
public class LogProducer {

    private final KafkaTemplate<String, LogRecord> kafkaTemplate;
    private final PipelineMetrics pipelineMetrics;
    private final String topic;
    private final Duration publishTimeout;

    public LogProducer(KafkaTemplate<String, LogRecord> kafkaTemplate,
                       PipelineMetrics pipelineMetrics,
                       LogPipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.pipelineMetrics = pipelineMetrics;
        this.topic = properties.kafka().topic();
        this.publishTimeout = properties.kafka().publishTimeout();
    }

    /**
     * @return true once every in-sync replica acknowledged the record, false on error or timeout
     */
    public boolean publish(LogRecord record) {
        long startTime = System.nanoTime();
        try {
            SendResult<String, LogRecord> result = kafkaTemplate
                    .send(topic, record.service(), record)
                    .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);

            pipelineMetrics.recordLogPublished();
            pipelineMetrics.recordApiResponse(startTime);
            if (result != null && result.getRecordMetadata() != null) {
                log.debug("Log sent to Kafka: service={}, partition={}, offset={}",
                        record.service(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(record, "interrupted while waiting for acknowledgment");
        } catch (TimeoutException e) {
            return failed(record, "no acknowledgment within " + publishTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(record, cause.getMessage());
        } catch (RuntimeException e) {
            return failed(record, e.getMessage());
        }
    }

    /**
     * Publishes each record independently; one failure does not stop the rest.
     */
    public BatchPublishResult publishAll(List<LogRecord> records) {
        int queued = 0;
        for (LogRecord record : records) {
            if (publish(record)) {
                queued++;
            }
        }
        return new BatchPublishResult(queued, records.size() - queued);
    }

    private boolean failed(LogRecord record, String reason) {
        pipelineMetrics.recordPublishFailed();
        log.error("Failed to send log to Kafka: service={}, projectId={}, error={}",
                record.service(), record.projectId(), reason);
        return false;
    }

    public record BatchPublishResult(int queued, int failed) {

        public boolean allFailed() {
            return queued == 0 && failed > 0;
        }
    }
}
