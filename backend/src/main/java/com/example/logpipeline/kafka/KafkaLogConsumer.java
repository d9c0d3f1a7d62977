package com.example.logpipeline.kafka;

import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes each delivered record through the configured backend. Offsets are auto-committed,
 * so delivery is at least once and a failed record is never requeued; it is logged with its
 * partition and offset and parked on the dead letter topic instead.
 * <p>
 * Payloads are taken as {@code List<?>}: the batch converter hands a {@code KafkaNull} in place of
 * a value the deserializer could not read, and that element is counted as failed on its own.
 */
@Slf4j
@Service
public class KafkaLogConsumer {

    private final StorageBackendSelector storageBackendSelector;
    private final DeadLetterPublisher deadLetterPublisher;
    private final PipelineMetrics pipelineMetrics;

    public KafkaLogConsumer(StorageBackendSelector storageBackendSelector,
                            DeadLetterPublisher deadLetterPublisher,
                            PipelineMetrics pipelineMetrics) {
        this.storageBackendSelector = storageBackendSelector;
        this.deadLetterPublisher = deadLetterPublisher;
        this.pipelineMetrics = pipelineMetrics;
    }

    @KafkaListener(topics = "${logpipeline.kafka.topic:logs}", groupId = "${logpipeline.kafka.group-id:log-consumer-group}")
    public void consumeLogBatch(
            List<?> records,
            @Header(KafkaHeaders.RECEIVED_PARTITION) List<Integer> partitions,
            @Header(KafkaHeaders.OFFSET) List<Long> offsets) {
        processBatch(records, partitions, offsets);
    }

    BatchOutcome processBatch(List<?> records, List<Integer> partitions, List<Long> offsets) {
        long startTime = System.nanoTime();
        log.info("Received batch of {} logs from partition(s) {}",
                records.size(),
                partitions.stream().distinct().toList());

        LogStorageBackend backend;
        try {
            backend = storageBackendSelector.getDefault();
        } catch (Exception e) {
            log.error("Storage backend unavailable, dead-lettering batch of {}: {}", records.size(), e.getMessage());
            backend = null;
        }

        int successfulLogs = 0;
        int failedLogs = 0;
        for (int i = 0; i < records.size(); i++) {
            Object payload = records.get(i);
            int partition = partitions.get(i);
            long offset = offsets.get(i);

            if (!(payload instanceof LogRecord)) {
                failedLogs++;
                log.error("Skipping undeserializable log [partition={}, offset={}]: {}", partition, offset,
                        payload == null ? "null" : payload.getClass().getSimpleName());
                continue;
            }
            LogRecord record = (LogRecord) payload;
            if (backend == null) {
                failedLogs++;
                deadLetterPublisher.send(record, "storage backend unavailable", partition, offset);
                continue;
            }

            try {
                if (backend.save(record)) {
                    successfulLogs++;
                } else {
                    failedLogs++;
                    deadLetterPublisher.send(record, backend.type().backendName() + " rejected the record",
                            partition, offset);
                }
            } catch (Exception e) {
                failedLogs++;
                log.error("Failed to process log [partition={}, offset={}]: service={}, projectId={}, error={}",
                        partition, offset, record.service(), record.projectId(), e.getMessage());
                deadLetterPublisher.send(record, e.getMessage(), partition, offset);
            }
        }

        pipelineMetrics.recordBatchConsumed(successfulLogs);
        pipelineMetrics.recordSaveFailed(failedLogs);
        pipelineMetrics.recordConsumerBatchProcessingTime(startTime);

        log.info("Batch processing complete: {} succeeded, {} failed in {}ms",
                successfulLogs, failedLogs, (System.nanoTime() - startTime) / 1_000_000);
        return new BatchOutcome(successfulLogs, failedLogs);
    }

    public record BatchOutcome(int succeeded, int failed) {
    }
}
